package com.edge.dataset.core.format.voc;

import com.edge.dataset.config.ConverterConfig;
import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.format.voc.dto.VocAnnotation;
import com.edge.dataset.core.format.voc.dto.VocObject;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.BBox;
import com.edge.dataset.core.model.Category;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class VocWriterTest {

    @TempDir
    Path tempDir;

    private final VocWriter writer = new VocWriter(new ConverterConfig().getVoc());

    private static Dataset sample() {
        Dataset dataset = new Dataset();
        dataset.addCategory(new Category(0, "dog"));
        dataset.addCategory(new Category(1, "cat"));
        Image image = new Image("photos/img_7.jpg", 640, 480);
        image.addAnnotation(new Annotation(BBox.of(10.4, 20.6, 110.5, 220.0), 0, "dog", true, false));
        image.addAnnotation(new Annotation(BBox.of(1, 2, 3, 4), 1, "cat"));
        dataset.addImage(image);
        return dataset;
    }

    @Test
    void buildsDocumentWithRoundedBoxAndFlags() {
        Image image = sample().getImages().get(0);

        VocAnnotation doc = writer.toDocument(image);

        assertThat(doc.getFilename()).isEqualTo("photos/img_7.jpg");
        assertThat(doc.getFolder()).isEqualTo("images");
        assertThat(doc.getSize().getWidth()).isEqualTo("640");
        assertThat(doc.getSize().getDepth()).isEqualTo("3");
        assertThat(doc.getObjects()).hasSize(2);

        VocObject dog = doc.getObjects().get(0);
        assertThat(dog.getName()).isEqualTo("dog");
        assertThat(dog.getDifficult()).isEqualTo("1");
        assertThat(dog.getTruncated()).isEqualTo("0");
        assertThat(dog.getBndbox().getXmin()).isEqualTo("10");
        assertThat(dog.getBndbox().getYmin()).isEqualTo("21");
        assertThat(dog.getBndbox().getXmax()).isEqualTo("111");
        assertThat(dog.getBndbox().getYmax()).isEqualTo("220");

        assertThat(doc.getObjects().get(1).getDifficult()).isEqualTo("0");
    }

    @Test
    void writesOneXmlPerImageNamedAfterBaseName() throws Exception {
        writer.write(sample(), tempDir, new ConvertOptions());

        Path xml = tempDir.resolve("img_7.xml");
        assertThat(xml).exists();
        String content = Files.readString(xml);
        assertThat(content).startsWith("<?xml");
        assertThat(content).contains("<annotation>", "<object>", "<name>dog</name>", "<difficult>1</difficult>");
    }

    @Test
    void unknownSizeIsWrittenAsZero() {
        VocAnnotation doc = writer.toDocument(new Image("x.jpg"));

        assertThat(doc.getSize().getWidth()).isEqualTo("0");
        assertThat(doc.getSize().getHeight()).isEqualTo("0");
        assertThat(doc.getObjects()).isEmpty();
    }

    @Test
    void writtenFilesReadBackWithSameContent() throws Exception {
        writer.write(sample(), tempDir, new ConvertOptions());

        Dataset read = new VocReader().read(tempDir, new ConvertOptions());

        assertThat(read.getCategories()).extracting(Category::getName).containsExactly("dog", "cat");
        Image image = read.getImages().get(0);
        assertThat(image.getWidth()).isEqualTo(640);
        Annotation dog = image.getAnnotations().get(0);
        assertThat(dog.isDifficult()).isTrue();
        assertThat(dog.isTruncated()).isFalse();
        assertThat(dog.getBbox()).isEqualTo(BBox.of(10, 21, 111, 220));
    }
}
