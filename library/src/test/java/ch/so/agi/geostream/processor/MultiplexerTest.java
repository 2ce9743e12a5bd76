package ch.so.agi.geostream.processor;

import static org.assertj.core.api.Assertions.assertThat;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.RecordingProcessor;
import org.junit.jupiter.api.Test;

class MultiplexerTest {
    @Test
    void deliversEveryEventToBothProcessors() throws Exception {
        RecordingProcessor primary = new RecordingProcessor();
        BoundsProcessor secondary = new BoundsProcessor();
        Multiplexer multiplexer = new Multiplexer(primary, secondary);

        multiplexer.multiPointBegin(2, 0);
        multiplexer.xy(1, 2, 0);
        multiplexer.xy(3, 4, 1);
        multiplexer.multiPointEnd(0);

        assertThat(primary.events()).containsExactly(
                "multiPointBegin(2, 0)",
                "xy(1.0, 2.0, 0)",
                "xy(3.0, 4.0, 1)",
                "multiPointEnd(0)");
        assertThat(secondary.bounds()).contains(new Bounds(1, 2, 3, 4));
    }

    @Test
    void requestsUnionOfDimensions() {
        Multiplexer multiplexer = new Multiplexer(
                new RecordingProcessor(CoordDimensions.xyz()),
                new RecordingProcessor(CoordDimensions.xym()));

        assertThat(multiplexer.dimensions()).isEqualTo(CoordDimensions.xyzm());
        assertThat(multiplexer.multiDim()).isTrue();
    }

    @Test
    void staysTwoDimensionalWhenNeitherAsks() {
        Multiplexer multiplexer = new Multiplexer(new RecordingProcessor(), new GeomSink());

        assertThat(multiplexer.dimensions()).isEqualTo(CoordDimensions.xy());
        assertThat(multiplexer.multiDim()).isFalse();
    }
}
