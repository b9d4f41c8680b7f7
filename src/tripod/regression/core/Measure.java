package tripod.regression.core;

import java.io.Serializable;

/**
 * POJO data point (x, y)
 */
public class Measure implements Serializable {
    private static final long serialVersionUID = 0x45f2411f7f3052c6l;

    private String name; // measure name
    private String comments; // any comments
    private Double x;
    private Double y;

    public Measure () {}
    public Measure (String name) { this.name = name; }
    public Measure (Double x, Double y) {
        this.x = x;
        this.y = y;
    }

    public Measure setName (String name) {
        this.name = name;
        return this;
    }
    public String getName () { return name; }

    public Measure setComments (String comments) {
        this.comments = comments;
        return this;
    }
    public String getComments () { return comments; }

    public Measure setX (Double x) {
        this.x = x;
        return this;
    }
    public Double getX () { return x; }

    public Measure setY (Double y) {
        this.y = y;
        return this;
    }
    public Double getY () { return y; }

    // both coordinates present?
    public boolean isComplete () { return x != null && y != null; }

    public String toString () {
        return getClass().getName()+"{name="+getName()+",comments="
            +getComments()+",x="+getX()+",y="+getY()+"}";
    }
}
