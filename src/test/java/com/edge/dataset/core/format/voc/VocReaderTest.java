package com.edge.dataset.core.format.voc;

import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.Category;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.edge.dataset.exception.FormatException;
import com.edge.dataset.exception.MissingResourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VocReaderTest {

    @TempDir
    Path tempDir;

    private final VocReader reader = new VocReader();

    private static String document(String filename, String objects) {
        return """
            <?xml version="1.0" encoding="UTF-8"?>
            <annotation>
              <folder>images</folder>
              <filename>%s</filename>
              <size>
                <width>640</width>
                <height>480</height>
                <depth>3</depth>
              </size>
              <segmented>0</segmented>
            %s
            </annotation>
            """.formatted(filename, objects);
    }

    private static String object(String name, String difficult, String truncated, int xmin, int ymin, int xmax, int ymax) {
        return """
              <object>
                <name>%s</name>
                <pose>Unspecified</pose>
                <truncated>%s</truncated>
                <difficult>%s</difficult>
                <bndbox>
                  <xmin>%d</xmin>
                  <ymin>%d</ymin>
                  <xmax>%d</xmax>
                  <ymax>%d</ymax>
                </bndbox>
              </object>
            """.formatted(name, truncated, difficult, xmin, ymin, xmax, ymax);
    }

    @Test
    void readsObjectsAndFlags() throws Exception {
        Files.writeString(tempDir.resolve("a.xml"), document("a.jpg",
            object("dog", "1", "0", 10, 20, 110, 220) + object("cat", "0", "1", 5, 5, 50, 50)));

        Dataset dataset = reader.read(tempDir, new ConvertOptions());

        assertThat(dataset.getImages()).hasSize(1);
        Image image = dataset.getImages().get(0);
        assertThat(image.getFileName()).isEqualTo("a.jpg");
        assertThat(image.getWidth()).isEqualTo(640);
        assertThat(image.getHeight()).isEqualTo(480);

        Annotation dog = image.getAnnotations().get(0);
        assertThat(dog.getCategoryName()).isEqualTo("dog");
        assertThat(dog.isDifficult()).isTrue();
        assertThat(dog.isTruncated()).isFalse();
        assertThat(dog.getBbox().getXmin()).isEqualTo(10.0);
        assertThat(dog.getBbox().getYmax()).isEqualTo(220.0);

        Annotation cat = image.getAnnotations().get(1);
        assertThat(cat.isDifficult()).isFalse();
        assertThat(cat.isTruncated()).isTrue();
    }

    @Test
    void assignsCategoryIdsInOrderOfFirstAppearance() throws Exception {
        Files.writeString(tempDir.resolve("1.xml"), document("1.jpg",
            object("zebra", "0", "0", 0, 0, 10, 10) + object("ant", "0", "0", 0, 0, 10, 10)));
        Files.writeString(tempDir.resolve("2.xml"), document("2.jpg",
            object("ant", "0", "0", 0, 0, 10, 10) + object("moose", "0", "0", 0, 0, 10, 10)));

        Dataset dataset = reader.read(tempDir, new ConvertOptions());

        assertThat(dataset.getCategories()).extracting(Category::getName).containsExactly("zebra", "ant", "moose");
        assertThat(dataset.getCategories()).extracting(Category::getId).containsExactly(0, 1, 2);
        assertThat(dataset.getImages().get(1).getAnnotations().get(0).getCategoryId()).isEqualTo(1);
    }

    @Test
    void keepsObjectsSeparatedByOtherElements() throws Exception {
        Files.writeString(tempDir.resolve("a.xml"), """
            <annotation>
              <filename>a.jpg</filename>
              <object>
                <name>dog</name>
                <bndbox><xmin>1</xmin><ymin>2</ymin><xmax>30</xmax><ymax>40</ymax></bndbox>
              </object>
              <size><width>64</width><height>48</height><depth>3</depth></size>
              <object>
                <name>cat</name>
                <bndbox><xmin>5</xmin><ymin>6</ymin><xmax>20</xmax><ymax>25</ymax></bndbox>
              </object>
              <segmented>0</segmented>
              <object>
                <name>dog</name>
                <bndbox><xmin>7</xmin><ymin>8</ymin><xmax>9</xmax><ymax>10</ymax></bndbox>
              </object>
            </annotation>
            """);

        Dataset dataset = reader.read(tempDir, new ConvertOptions());

        Image image = dataset.getImages().get(0);
        assertThat(image.getAnnotations()).extracting(Annotation::getCategoryName)
            .containsExactly("dog", "cat", "dog");
        assertThat(dataset.getCategories()).extracting(Category::getName).containsExactly("dog", "cat");
        assertThat(image.getWidth()).isEqualTo(64);
    }

    @Test
    void missingFlagsDefaultToFalse() throws Exception {
        Files.writeString(tempDir.resolve("a.xml"), document("a.jpg", """
              <object>
                <name>dog</name>
                <bndbox><xmin>1</xmin><ymin>2</ymin><xmax>3</xmax><ymax>4</ymax></bndbox>
              </object>
            """));

        Annotation annotation = reader.read(tempDir, new ConvertOptions())
            .getImages().get(0).getAnnotations().get(0);

        assertThat(annotation.isDifficult()).isFalse();
        assertThat(annotation.isTruncated()).isFalse();
    }

    @Test
    void imageWithoutObjectsIsKept() throws Exception {
        Files.writeString(tempDir.resolve("empty.xml"), document("empty.jpg", ""));

        Dataset dataset = reader.read(tempDir, new ConvertOptions());

        assertThat(dataset.getImages()).hasSize(1);
        assertThat(dataset.getImages().get(0).getAnnotations()).isEmpty();
        assertThat(dataset.getCategories()).isEmpty();
    }

    @Test
    void ignoresNonXmlFiles() throws Exception {
        Files.writeString(tempDir.resolve("notes.txt"), "not an annotation");
        Files.writeString(tempDir.resolve("a.xml"), document("a.jpg", ""));

        assertThat(reader.read(tempDir, new ConvertOptions()).getImages()).hasSize(1);
    }

    @Test
    void missingBndboxCoordinateFailsWithFormatError() throws Exception {
        Files.writeString(tempDir.resolve("a.xml"), document("a.jpg", """
              <object>
                <name>dog</name>
                <bndbox><xmin>1</xmin><ymin>2</ymin><xmax>3</xmax></bndbox>
              </object>
            """));

        assertThatThrownBy(() -> reader.read(tempDir, new ConvertOptions()))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("bndbox/ymax");
    }

    @Test
    void missingSizeFailsWithFormatError() throws Exception {
        Files.writeString(tempDir.resolve("a.xml"), """
            <annotation>
              <filename>a.jpg</filename>
            </annotation>
            """);

        assertThatThrownBy(() -> reader.read(tempDir, new ConvertOptions()))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("size");
    }

    @Test
    void nonNumericCoordinateFailsWithFormatError() throws Exception {
        Files.writeString(tempDir.resolve("a.xml"), document("a.jpg", """
              <object>
                <name>dog</name>
                <bndbox><xmin>left</xmin><ymin>2</ymin><xmax>3</xmax><ymax>4</ymax></bndbox>
              </object>
            """));

        assertThatThrownBy(() -> reader.read(tempDir, new ConvertOptions()))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("bndbox/xmin");
    }

    @Test
    void malformedXmlFailsWithFormatError() throws Exception {
        Files.writeString(tempDir.resolve("a.xml"), "<annotation><filename>a.jpg</filename>");

        assertThatThrownBy(() -> reader.read(tempDir, new ConvertOptions()))
            .isInstanceOf(FormatException.class);
    }

    @Test
    void missingDirectoryFailsWithMissingResource() {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("absent"), new ConvertOptions()))
            .isInstanceOf(MissingResourceException.class);
    }

    @Test
    void parsesFlagSpellings() {
        Path file = Path.of("a.xml");
        assertThat(VocReader.parseFlag("1", "difficult", file)).isTrue();
        assertThat(VocReader.parseFlag("TRUE", "difficult", file)).isTrue();
        assertThat(VocReader.parseFlag(" 0 ", "difficult", file)).isFalse();
        assertThat(VocReader.parseFlag(null, "difficult", file)).isFalse();
        assertThatThrownBy(() -> VocReader.parseFlag("maybe", "difficult", file))
            .isInstanceOf(FormatException.class);
    }
}
