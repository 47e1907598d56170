package com.edge.dataset.core.format.voc;

import com.edge.dataset.config.ConverterConfig;
import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.format.DatasetFormat;
import com.edge.dataset.core.format.FormatWriter;
import com.edge.dataset.core.format.voc.dto.VocAnnotation;
import com.edge.dataset.core.format.voc.dto.VocBndBox;
import com.edge.dataset.core.format.voc.dto.VocObject;
import com.edge.dataset.core.format.voc.dto.VocSize;
import com.edge.dataset.core.format.voc.dto.VocSource;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.BBox;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Pascal VOC 格式写出
 * <p>
 * 每张图片一个同名 XML；bndbox 取整到像素，difficult / truncated 写为 0/1
 */
public class VocWriter implements FormatWriter {
    private static final Logger logger = LoggerFactory.getLogger(VocWriter.class);

    private final XmlMapper xmlMapper;
    private final ConverterConfig.VocConfig config;

    public VocWriter(ConverterConfig.VocConfig config) {
        this.config = config;
        this.xmlMapper = new XmlMapper();
        this.xmlMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.xmlMapper.configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, true);
    }

    @Override
    public DatasetFormat getFormat() {
        return DatasetFormat.VOC;
    }

    @Override
    public void write(Dataset dataset, Path outputDir, ConvertOptions options) throws IOException {
        Files.createDirectories(outputDir);

        for (Image image : dataset.getImages()) {
            Path xmlPath = outputDir.resolve(image.getBaseName() + ".xml");
            try (OutputStream out = Files.newOutputStream(xmlPath)) {
                xmlMapper.writeValue(out, toDocument(image));
            }
            logger.debug("Wrote {} objects to {}", image.getAnnotations().size(), xmlPath);
        }

        logger.info("Wrote VOC annotations for {} images to {}", dataset.getImages().size(), outputDir);
    }

    VocAnnotation toDocument(Image image) {
        VocAnnotation doc = new VocAnnotation();
        doc.setFolder(config.getFolder());
        doc.setFilename(image.getFileName());
        doc.setPath(image.getFileName());
        doc.setSource(new VocSource(config.getDatabase()));
        doc.setSize(new VocSize(
            image.getWidth() != null ? String.valueOf(image.getWidth()) : "0",
            image.getHeight() != null ? String.valueOf(image.getHeight()) : "0",
            String.valueOf(config.getDepth())));
        doc.setSegmented("0");

        List<VocObject> objects = new ArrayList<>();
        for (Annotation annotation : image.getAnnotations()) {
            VocObject obj = new VocObject();
            obj.setName(annotation.getCategoryName());
            obj.setPose(config.getPose());
            obj.setTruncated(annotation.isTruncated() ? "1" : "0");
            obj.setDifficult(annotation.isDifficult() ? "1" : "0");

            BBox bbox = annotation.getBbox();
            obj.setBndbox(new VocBndBox(
                pixel(bbox.getXmin()), pixel(bbox.getYmin()),
                pixel(bbox.getXmax()), pixel(bbox.getYmax())));
            objects.add(obj);
        }
        doc.setObjects(objects);
        return doc;
    }

    private static String pixel(double value) {
        return String.valueOf(Math.round(value));
    }
}
