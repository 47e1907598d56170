package com.edge.dataset.cli;

import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.exception.ConverterException;
import com.edge.dataset.service.ConversionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * 命令行入口：dataset-convert &lt;source&gt; &lt;target&gt; -i &lt;input&gt; -o &lt;output&gt;
 * <p>
 * 退出码：0 成功，1 转换失败，2 参数错误
 */
@Component
@Command(name = "dataset-convert",
    version = "dataset-convert 0.1.0",
    description = "Convert between object detection annotation formats (COCO, YOLO, Pascal VOC)",
    footer = {
        "",
        "Examples:",
        "  dataset-convert coco yolo -i annotations.json -o labels/ --classes classes.txt",
        "  dataset-convert yolo voc -i labels/ -o voc/ --images images/ --classes classes.txt",
        "  dataset-convert voc coco -i voc/ -o annotations.json"
    })
public class ConvertCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ConvertCommand.class);

    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    @Parameters(index = "0", paramLabel = "SOURCE", description = "Source format: coco, yolo, voc")
    String source;

    @Parameters(index = "1", paramLabel = "TARGET", description = "Target format: coco, yolo, voc")
    String target;

    @Option(names = {"-i", "--input"}, required = true,
        description = "Input path (file for COCO, directory for YOLO/VOC)")
    Path input;

    @Option(names = {"-o", "--output"}, required = true,
        description = "Output path (file for COCO, directory for YOLO/VOC)")
    Path output;

    @Option(names = "--images", description = "Images directory (required for YOLO as source)")
    Path images;

    @Option(names = "--classes", description = "Classes file (required for YOLO as source, written for YOLO as target)")
    Path classes;

    @Option(names = "--output-classes", description = "Classes file to write for YOLO output (defaults to --classes)")
    Path outputClasses;

    // 未指定时使用 dataset-converter.yolo.image-ext（默认 .jpg）
    @Option(names = "--image-ext", description = "Image file extension for YOLO (default: .jpg)")
    String imageExt;

    @Option(names = {"-v", "--version"}, versionHelp = true, description = "Print version information and exit")
    boolean versionRequested;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    boolean helpRequested;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final ConversionEngine engine;

    public ConvertCommand(ConversionEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if ("yolo".equalsIgnoreCase(source) && (images == null || classes == null)) {
            err.println("YOLO source format requires --images and --classes arguments");
            return EXIT_USAGE;
        }

        ConvertOptions options = new ConvertOptions();
        options.setImagesDir(images);
        options.setClassesFile(classes);
        options.setOutputClassesFile(outputClasses);
        options.setImageExt(imageExt);

        try {
            out.printf("Converting %s -> %s...%n", upper(source), upper(target));
            out.printf("Input: %s%n", input);
            out.printf("Output: %s%n", output);

            Dataset dataset = engine.convert(source, target, input, output, options);

            out.println();
            out.println("Conversion completed successfully!");
            out.printf("Images: %d%n", dataset.getImages().size());
            out.printf("Categories: %d%n", dataset.getCategories().size());
            out.printf("Total annotations: %d%n", dataset.getAnnotationCount());
            out.flush();
            return CommandLine.ExitCode.OK;
        } catch (ConverterException | IOException e) {
            logger.error("Conversion {} -> {} failed", source, target, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
    }

    private static String upper(String format) {
        return format != null ? format.toUpperCase(Locale.ROOT) : "";
    }
}
