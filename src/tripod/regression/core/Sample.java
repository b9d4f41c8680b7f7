package tripod.regression.core;

import java.io.Serializable;
import java.util.List;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;

/**
 * POJO sample set of (x, y) measures
 */
public class Sample implements Serializable {
    private static final long serialVersionUID = 0xd7d0162de412cf16l;

    private String name; // sample name
    private String comments; // any comments
    private List<Measure> measures = new ArrayList<Measure>();

    public Sample () {}
    public Sample (String name) {
        this.name = name;
    }

    public Sample setName (String name) {
        this.name = name;
        return this;
    }
    public String getName () { return name; }

    public Sample setComments (String comments) {
        this.comments = comments;
        return this;
    }
    public String getComments () { return comments; }

    public Sample add (Measure measure) {
        measures.add(measure);
        return this;
    }
    public Sample add (double x, double y) {
        return add (new Measure (x, y));
    }
    public int size () { return measures.size(); }

    public Measure get (int pos) { return measures.get(pos); }
    public Iterator<Measure> measures () {
        return measures.iterator();
    }

    public List<Measure> getMeasures () {
        return Collections.unmodifiableList(measures);
    }

    /**
     * x coordinates of the complete measures in order; the
     * returned array is a fresh copy
     */
    public double[] getX () {
        List<Measure> complete = getCompleteMeasures ();
        double[] x = new double[complete.size()];
        for (int i = 0; i < x.length; ++i)
            x[i] = complete.get(i).getX();
        return x;
    }

    /**
     * y coordinates matching {@link #getX()}
     */
    public double[] getY () {
        List<Measure> complete = getCompleteMeasures ();
        double[] y = new double[complete.size()];
        for (int i = 0; i < y.length; ++i)
            y[i] = complete.get(i).getY();
        return y;
    }

    public List<Measure> getCompleteMeasures () {
        List<Measure> complete = new ArrayList<Measure>();
        for (Measure m : measures) {
            if (m.isComplete()) {
                complete.add(m);
            }
        }
        return complete;
    }

    public String toString () { return name; }
}
