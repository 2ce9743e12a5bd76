package ch.so.agi.geostream.processor;

import static org.assertj.core.api.Assertions.assertThat;

import ch.so.agi.geostream.RecordingProcessor;
import ch.so.agi.geostream.wkb.Wkb;
import ch.so.agi.geostream.wkb.WkbDialect;
import ch.so.agi.geostream.wkb.WkbWriter;
import java.io.ByteArrayOutputStream;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class PromoteToMultiTest {
    @Test
    void promotesPointToMultiPoint() throws Exception {
        RecordingProcessor promoted = new RecordingProcessor();
        PromoteToMulti processor = new PromoteToMulti(promoted);
        processor.pointBegin(0);
        processor.xy(7, 8, 0);
        processor.pointEnd(0);

        RecordingProcessor direct = new RecordingProcessor();
        direct.multiPointBegin(1, 0);
        direct.xy(7, 8, 0);
        direct.multiPointEnd(0);

        assertThat(promoted.events()).isEqualTo(direct.events());
    }

    @Test
    void promotesEmptyPointToEmptyMultiPoint() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        PromoteToMulti processor = new PromoteToMulti(recorder);

        processor.pointBegin(0);
        processor.pointEnd(0);

        assertThat(recorder.events()).containsExactly("multiPointBegin(0, 0)", "multiPointEnd(0)");
    }

    @Test
    void writesEmptyPointAsReadableEmptyMultiPoint() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PromoteToMulti processor = new PromoteToMulti(new WkbWriter(out, WkbDialect.WKB));

        processor.pointBegin(0);
        processor.pointEnd(0);

        byte[] wkb = out.toByteArray();
        assertThat(HexFormat.of().formatHex(wkb)).isEqualTo("010400000000000000");

        RecordingProcessor decoded = new RecordingProcessor();
        Wkb.decode(wkb, WkbDialect.WKB, decoded);
        assertThat(decoded.events()).containsExactly("multiPointBegin(0, 0)", "multiPointEnd(0)");
    }

    @Test
    void promotesLineStringToMultiLineString() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        PromoteToMulti processor = new PromoteToMulti(recorder);

        processor.lineStringBegin(true, 2, 0);
        processor.xy(0, 0, 0);
        processor.xy(1, 1, 1);
        processor.lineStringEnd(true, 0);

        assertThat(recorder.events()).containsExactly(
                "multiLineStringBegin(1, 0)",
                "lineStringBegin(false, 2, 0)",
                "xy(0.0, 0.0, 0)",
                "xy(1.0, 1.0, 1)",
                "lineStringEnd(false, 0)",
                "multiLineStringEnd(0)");
    }

    @Test
    void promotesPolygonAndKeepsRingsUntagged() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        PromoteToMulti processor = new PromoteToMulti(recorder);

        processor.polygonBegin(true, 1, 0);
        processor.lineStringBegin(false, 4, 0);
        processor.xy(0, 0, 0);
        processor.xy(1, 0, 1);
        processor.xy(0, 1, 2);
        processor.xy(0, 0, 3);
        processor.lineStringEnd(false, 0);
        processor.polygonEnd(true, 0);

        assertThat(recorder.events()).startsWith(
                "multiPolygonBegin(1, 0)",
                "polygonBegin(false, 1, 0)",
                "lineStringBegin(false, 4, 0)");
        assertThat(recorder.events()).endsWith(
                "lineStringEnd(false, 0)",
                "polygonEnd(false, 0)",
                "multiPolygonEnd(0)");
    }

    @Test
    void leavesMultiGeometriesUnchanged() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        PromoteToMulti processor = new PromoteToMulti(recorder);

        processor.multiLineStringBegin(1, 0);
        processor.lineStringBegin(false, 1, 0);
        processor.xy(5, 5, 0);
        processor.lineStringEnd(false, 0);
        processor.multiLineStringEnd(0);

        assertThat(recorder.events()).containsExactly(
                "multiLineStringBegin(1, 0)",
                "lineStringBegin(false, 1, 0)",
                "xy(5.0, 5.0, 0)",
                "lineStringEnd(false, 0)",
                "multiLineStringEnd(0)");
    }
}
