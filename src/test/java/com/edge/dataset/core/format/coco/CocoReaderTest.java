package com.edge.dataset.core.format.coco;

import com.edge.dataset.core.format.ConvertOptions;
import com.edge.dataset.core.model.Annotation;
import com.edge.dataset.core.model.Dataset;
import com.edge.dataset.core.model.Image;
import com.edge.dataset.exception.DuplicateCategoryException;
import com.edge.dataset.exception.FormatException;
import com.edge.dataset.exception.MissingResourceException;
import com.edge.dataset.exception.ReferenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CocoReaderTest {

    @TempDir
    Path tempDir;

    private final CocoReader reader = new CocoReader();

    private Path writeJson(String json) throws IOException {
        Path file = tempDir.resolve("annotations.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void readsImagesCategoriesAndAnnotations() throws Exception {
        Path file = writeJson("""
            {
              "info": {"description": "unit"},
              "images": [
                {"id": 10, "file_name": "a.jpg", "width": 640, "height": 480},
                {"id": 11, "file_name": "b.jpg", "width": 800, "height": 600}
              ],
              "annotations": [
                {"id": 1, "image_id": 10, "category_id": 3, "bbox": [10, 20, 30, 40], "area": 1200, "iscrowd": 0},
                {"id": 2, "image_id": 10, "category_id": 1, "bbox": [0, 0, 5.5, 5.5]},
                {"id": 3, "image_id": 11, "category_id": 3, "bbox": [100, 100, 50, 50], "segmentation": {"counts": [1, 2], "size": [600, 800]}, "iscrowd": 1}
              ],
              "categories": [
                {"id": 1, "name": "person", "supercategory": "human"},
                {"id": 3, "name": "car"}
              ]
            }
            """);

        Dataset dataset = reader.read(file, new ConvertOptions());

        assertThat(dataset.getInfo()).containsEntry("description", "unit");
        assertThat(dataset.getCategories()).hasSize(2);
        assertThat(dataset.getCategoryById(1).getSupercategory()).isEqualTo("human");
        assertThat(dataset.getImages()).hasSize(2);

        Image first = dataset.getImages().get(0);
        assertThat(first.getImageId()).isEqualTo(10);
        assertThat(first.getWidth()).isEqualTo(640);
        assertThat(first.getAnnotations()).hasSize(2);

        Annotation car = first.getAnnotations().get(0);
        assertThat(car.getCategoryId()).isEqualTo(3);
        assertThat(car.getCategoryName()).isEqualTo("car");
        assertThat(car.getBbox().getXmax()).isCloseTo(40.0, within(1e-9));
        assertThat(car.getBbox().getYmax()).isCloseTo(60.0, within(1e-9));
        assertThat(car.isDifficult()).isFalse();

        Annotation crowd = dataset.getImages().get(1).getAnnotations().get(0);
        assertThat(crowd.getIscrowd()).isEqualTo(1);
        assertThat(crowd.getArea()).isCloseTo(2500.0, within(1e-9));
    }

    @Test
    void unknownCategoryIdFailsWithReferenceError() throws Exception {
        Path file = writeJson("""
            {"images": [{"id": 1, "file_name": "a.jpg", "width": 10, "height": 10}],
             "annotations": [{"image_id": 1, "category_id": 99, "bbox": [0, 0, 1, 1]}],
             "categories": [{"id": 1, "name": "person"}]}
            """);

        assertThatThrownBy(() -> reader.read(file, new ConvertOptions()))
            .isInstanceOf(ReferenceException.class)
            .hasMessageContaining("category_id 99");
    }

    @Test
    void unknownImageIdFailsWithReferenceError() throws Exception {
        Path file = writeJson("""
            {"images": [{"id": 1, "file_name": "a.jpg", "width": 10, "height": 10}],
             "annotations": [{"image_id": 2, "category_id": 1, "bbox": [0, 0, 1, 1]}],
             "categories": [{"id": 1, "name": "person"}]}
            """);

        assertThatThrownBy(() -> reader.read(file, new ConvertOptions()))
            .isInstanceOf(ReferenceException.class)
            .hasMessageContaining("image_id 2");
    }

    @Test
    void malformedJsonFailsWithFormatError() throws Exception {
        Path file = writeJson("{\"images\": [");

        assertThatThrownBy(() -> reader.read(file, new ConvertOptions()))
            .isInstanceOf(FormatException.class);
    }

    @Test
    void missingTopLevelKeyFailsWithFormatError() throws Exception {
        Path file = writeJson("{\"images\": [], \"annotations\": []}");

        assertThatThrownBy(() -> reader.read(file, new ConvertOptions()))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("categories");
    }

    @Test
    void annotationWithoutBboxFailsWithFormatError() throws Exception {
        Path file = writeJson("""
            {"images": [{"id": 1, "file_name": "a.jpg"}],
             "annotations": [{"image_id": 1, "category_id": 1}],
             "categories": [{"id": 1, "name": "person"}]}
            """);

        assertThatThrownBy(() -> reader.read(file, new ConvertOptions()))
            .isInstanceOf(FormatException.class);
    }

    @Test
    void bboxWithWrongArityFailsWithFormatError() throws Exception {
        Path file = writeJson("""
            {"images": [{"id": 1, "file_name": "a.jpg"}],
             "annotations": [{"image_id": 1, "category_id": 1, "bbox": [1, 2, 3]}],
             "categories": [{"id": 1, "name": "person"}]}
            """);

        assertThatThrownBy(() -> reader.read(file, new ConvertOptions()))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("bbox");
    }

    @Test
    void fractionalImageSizeFailsWithFormatError() throws Exception {
        Path file = writeJson("""
            {
              "images": [{"id": 1, "file_name": "a.jpg", "width": 640.7, "height": 480}],
              "annotations": [],
              "categories": []
            }
            """);

        assertThatThrownBy(() -> reader.read(file, new ConvertOptions()))
            .isInstanceOf(FormatException.class);
    }

    @Test
    void duplicateCategoryIdIsRejected() throws Exception {
        Path file = writeJson("""
            {"images": [], "annotations": [],
             "categories": [{"id": 1, "name": "a"}, {"id": 1, "name": "b"}]}
            """);

        assertThatThrownBy(() -> reader.read(file, new ConvertOptions()))
            .isInstanceOf(DuplicateCategoryException.class);
    }

    @Test
    void imageWithoutSizeIsReadAsUnknown() throws Exception {
        Path file = writeJson("""
            {"images": [{"id": 1, "file_name": "a.jpg"}],
             "annotations": [],
             "categories": []}
            """);

        Dataset dataset = reader.read(file, new ConvertOptions());

        assertThat(dataset.getImages().get(0).hasKnownSize()).isFalse();
    }

    @Test
    void missingFileFailsWithMissingResource() {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("nope.json"), new ConvertOptions()))
            .isInstanceOf(MissingResourceException.class);
    }
}
