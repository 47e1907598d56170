package com.edge.dataset.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "dataset-converter")
public class ConverterConfig {
    private YoloConfig yolo = new YoloConfig();
    private VocConfig voc = new VocConfig();
    private CocoConfig coco = new CocoConfig();

    @Data
    public static class YoloConfig {
        private int precision = 6;                     // 归一化坐标小数位数
        private String classesFileName = "classes.txt";
        private String imageExt = ".jpg";
        // 指定扩展名找不到图片时依次尝试
        private List<String> fallbackImageExts = new ArrayList<>(Arrays.asList(
                ".jpg", ".jpeg", ".png", ".bmp", ".JPG", ".JPEG", ".PNG", ".BMP"));
    }

    @Data
    public static class VocConfig {
        private String folder = "images";
        private String database = "Unknown";
        private int depth = 3;
        private String pose = "Unspecified";
    }

    @Data
    public static class CocoConfig {
        private boolean prettyPrint = true;
    }
}
