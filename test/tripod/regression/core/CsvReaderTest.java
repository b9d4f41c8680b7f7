package tripod.regression.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

public class CsvReaderTest {

    static InputStream stream (String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void readsTwoColumnRecordsIntoDefaultSample() throws IOException {
        CsvReader reader = new CsvReader(stream("x,y\n0,1\n1,2.5\n\n2,4\n"));

        Sample sample = reader.read();

        assertThat(sample.getName()).isEqualTo(CsvReader.DEFAULT_SAMPLE);
        assertThat(sample.getX()).containsExactly(0, 1, 2);
        assertThat(sample.getY()).containsExactly(1, 2.5, 4);
        assertThat(reader.read()).isNull();
    }

    @Test
    public void groupsConsecutiveRecordsByName() throws IOException {
        CsvReader reader = new CsvReader(stream(
            "Sample,X,Y\n"
            + "# decay first\n"
            + "decay,0,10.2\n"
            + "decay,1,6.1\n"
            + "\"growth\",0,1.0\n"
            + "growth,1,2.7\n"
            + "growth,2,7.4\n"));

        Sample decay = reader.read();
        Sample growth = reader.read();

        assertThat(decay.getName()).isEqualTo("decay");
        assertThat(decay.size()).isEqualTo(2);
        assertThat(growth.getName()).isEqualTo("growth");
        assertThat(growth.getY()).containsExactly(1.0, 2.7, 7.4);
        assertThat(reader.read()).isNull();
    }

    @Test
    public void malformedLinesAreSkipped() throws IOException {
        CsvReader reader = new CsvReader(stream(
            "0,1\n"
            + "1,2,3,4\n"
            + "2,abc\n"
            + "3,\n"
            + "4,16\n"));

        Sample sample = reader.read();

        assertThat(sample.getX()).containsExactly(0, 4);
        assertThat(sample.getY()).containsExactly(1, 16);
        assertThat(reader.getLineCount()).isEqualTo(5);
    }

    @Test
    public void headerAfterLeadingCommentIsNotAWarning() throws IOException {
        final List<LogRecord> warnings = new ArrayList<LogRecord>();
        Handler handler = new Handler() {
            public void publish (LogRecord record) {
                if (record.getLevel().intValue() >= Level.WARNING.intValue())
                    warnings.add(record);
            }
            public void flush () {}
            public void close () {}
        };
        Logger logger = Logger.getLogger(CsvReader.class.getName());
        logger.addHandler(handler);
        try {
            CsvReader reader = new CsvReader(stream(
                "# exported samples\n"
                + "\n"
                + "Sample,X,Y\n"
                + "decay,0,10.2\n"
                + "decay,1,6.1\n"));

            Sample sample = reader.read();

            assertThat(sample.getName()).isEqualTo("decay");
            assertThat(sample.getY()).containsExactly(10.2, 6.1);
            assertThat(warnings).isEmpty();
        }
        finally {
            logger.removeHandler(handler);
        }
    }

    @Test
    public void emptyStreamHasNoSample() throws IOException {
        assertThat(new CsvReader(stream("")).read()).isNull();
    }

    @Test
    public void tokenizerKeepsQuotedDelimiters() {
        assertThat(CsvReader.tokenizer("\"a,b\",1,2", ','))
            .containsExactly("a,b", "1", "2");
        assertThat(CsvReader.tokenizer("1,", ','))
            .containsExactly("1", null);
    }
}
