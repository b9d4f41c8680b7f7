package tripod.regression.core;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Logger;

public class CsvReader implements Reader {
    private static final Logger logger =
        Logger.getLogger(CsvReader.class.getName());

    public static final String DEFAULT_SAMPLE = "sample";

    /* parse csv records of either form:
x,y
name,x,y
       consecutive records with the same name make up one sample; a
       leading header line, blank lines and lines starting with #
       are ignored, e.g.,
Sample,X,Y
decay,0,10.2
decay,1,6.1
growth,0,1.0
growth,1,2.7
     */

    private int lines;
    private int records; // non-blank, non-comment lines seen so far
    private BufferedReader reader;
    private Measure pending; // first measure of the next sample
    private String pendingName;

    public CsvReader (InputStream is) throws IOException {
        reader = new BufferedReader
            (new InputStreamReader (is, StandardCharsets.UTF_8));
    }

    public Sample read () throws IOException {
        Sample sampl = null;
        if (pending != null) {
            sampl = new Sample (pendingName).add(pending);
            pending = null;
        }

        for (String line; (line = reader.readLine()) != null; ) {
            ++lines;
            line = line.trim();
            if (line.length() == 0 || line.startsWith("#")) {
                continue;
            }

            boolean first = records++ == 0;
            String[] toks = tokenizer (line, ',');
            if (toks.length != 2 && toks.length != 3) {
                logger.warning(lines+": invalid number of tokens "
                               +toks.length+"; expecting 2 or 3");
                continue;
            }

            int j = toks.length - 2;
            String name = j > 0 && toks[0] != null
                ? toks[0].trim() : DEFAULT_SAMPLE;
            Measure m;
            try {
                m = new Measure (parse (toks[j]), parse (toks[j+1]));
            }
            catch (NumberFormatException ex) {
                if (first) {
                    logger.fine("Skipping header: "+line);
                }
                else {
                    logger.warning(lines+": bogus number: "+line
                                   +"; either \""+toks[j]+"\" or \""
                                   +toks[j+1]+"\" is bogus!");
                }
                continue;
            }
            m.setName(name+"-"+lines);

            if (sampl == null) {
                sampl = new Sample (name);
            }
            else if (!name.equals(sampl.getName())) {
                pending = m;
                pendingName = name;
                break;
            }
            sampl.add(m);
        }

        return sampl;
    }

    public int getLineCount () { return lines; }

    static Double parse (String tok) {
        if (tok == null) {
            throw new NumberFormatException ("empty token");
        }
        return Double.parseDouble(tok.trim());
    }

    static String[] tokenizer (String line, char delim) {
        List<String> toks = new ArrayList<String>();

        int len = line.length(), parity = 0;
        StringBuilder curtok = new StringBuilder ();
        for (int i = 0; i < len; ++i) {
            char ch = line.charAt(i);
            if (ch == '"') {
                parity ^= 1;
            }
            if (ch == delim) {
                if (parity == 0) {
                    String tok = null;
                    if (curtok.length() > 0) {
                        tok = curtok.toString();
                    }
                    toks.add(tok);
                    curtok.setLength(0);
                }
                else {
                    curtok.append(ch);
                }
            }
            else if (ch != '"') {
                curtok.append(ch);
            }
        }

        if (curtok.length() > 0) {
            toks.add(curtok.toString());
        }
        // if the line ends with the delimiter, then append an empty token
        else if (line.charAt(line.length()-1) == delim)
            toks.add(null);

        return toks.toArray(new String[0]);
    }
}
