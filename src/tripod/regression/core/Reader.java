package tripod.regression.core;

import java.io.IOException;

public interface Reader {
    /**
     * return the next available sample (if any) from the stream.
     * if there isn't any sample left, null is returned.
     */
    Sample read () throws IOException;
}
