package com.edge.dataset.core.model;

/**
 * 边界框
 * <p>
 * 内部统一使用绝对像素坐标的左上/右下角点 (xmin, ymin, xmax, ymax)。
 * 支持与 COCO 的 [x, y, width, height] 以及 YOLO 归一化中心点格式互相转换。
 * <p>
 * 不做裁剪或合法性校验：越界、宽高为零或为负的框原样保留
 */
public final class BBox {
    private final double xmin;
    private final double ymin;
    private final double xmax;
    private final double ymax;

    private BBox(double xmin, double ymin, double xmax, double ymax) {
        this.xmin = xmin;
        this.ymin = ymin;
        this.xmax = xmax;
        this.ymax = ymax;
    }

    /**
     * 由绝对角点坐标构造
     */
    public static BBox of(double xmin, double ymin, double xmax, double ymax) {
        return new BBox(xmin, ymin, xmax, ymax);
    }

    /**
     * 由 COCO 格式 [x, y, width, height] 构造
     */
    public static BBox fromXywh(double x, double y, double width, double height) {
        return new BBox(x, y, x + width, y + height);
    }

    /**
     * 由 YOLO 归一化中心点格式构造
     *
     * @param xCenter     归一化中心点 X (0.0 - 1.0)
     * @param yCenter     归一化中心点 Y (0.0 - 1.0)
     * @param width       归一化宽度
     * @param height      归一化高度
     * @param imageWidth  图片宽度（像素）
     * @param imageHeight 图片高度（像素）
     */
    public static BBox fromNormalized(double xCenter, double yCenter, double width, double height,
                                      int imageWidth, int imageHeight) {
        double w = width * imageWidth;
        double h = height * imageHeight;
        double x = xCenter * imageWidth - w / 2.0;
        double y = yCenter * imageHeight - h / 2.0;
        return new BBox(x, y, x + w, y + h);
    }

    /**
     * 转换为 COCO 格式 [x, y, width, height]
     */
    public double[] toXywh() {
        return new double[]{xmin, ymin, getWidth(), getHeight()};
    }

    /**
     * 转换为 YOLO 归一化格式 [x_center, y_center, width, height]
     */
    public double[] toNormalized(int imageWidth, int imageHeight) {
        double w = getWidth();
        double h = getHeight();
        double xCenter = xmin + w / 2.0;
        double yCenter = ymin + h / 2.0;
        return new double[]{
            xCenter / imageWidth,
            yCenter / imageHeight,
            w / imageWidth,
            h / imageHeight
        };
    }

    public double getWidth() {
        return xmax - xmin;
    }

    public double getHeight() {
        return ymax - ymin;
    }

    public double getArea() {
        return getWidth() * getHeight();
    }

    /**
     * 宽高是否为正，仅供调用方判断，本类不据此拒绝
     */
    public boolean isValid() {
        return xmin < xmax && ymin < ymax;
    }

    public double getXmin() { return xmin; }
    public double getYmin() { return ymin; }
    public double getXmax() { return xmax; }
    public double getYmax() { return ymax; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BBox)) {
            return false;
        }
        BBox other = (BBox) o;
        return Double.compare(xmin, other.xmin) == 0
            && Double.compare(ymin, other.ymin) == 0
            && Double.compare(xmax, other.xmax) == 0
            && Double.compare(ymax, other.ymax) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(xmin);
        result = 31 * result + Double.hashCode(ymin);
        result = 31 * result + Double.hashCode(xmax);
        result = 31 * result + Double.hashCode(ymax);
        return result;
    }

    @Override
    public String toString() {
        return String.format("BBox[%.2f,%.2f - %.2f,%.2f] (%.2f x %.2f)",
            xmin, ymin, xmax, ymax, getWidth(), getHeight());
    }
}
