package ch.so.agi.geostream.processor;

import static org.assertj.core.api.Assertions.assertThat;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.RecordingProcessor;
import org.junit.jupiter.api.Test;

class BoundsProcessorTest {
    @Test
    void emptyLineStringHasNoBounds() throws Exception {
        BoundsProcessor processor = new BoundsProcessor();

        processor.lineStringBegin(true, 0, 0);
        processor.lineStringEnd(true, 0);

        assertThat(processor.bounds()).isEmpty();
    }

    @Test
    void accumulatesMinimumAndMaximum() throws Exception {
        BoundsProcessor processor = new BoundsProcessor();

        processor.lineStringBegin(true, 3, 0);
        processor.xy(1, 2, 0);
        processor.xy(3, 4, 1);
        processor.xy(5, 6, 2);
        processor.lineStringEnd(true, 0);

        assertThat(processor.bounds()).contains(new Bounds(1, 2, 5, 6));
    }

    @Test
    void forwardsEventsUnchanged() throws Exception {
        RecordingProcessor inner = new RecordingProcessor(CoordDimensions.xyz());
        BoundsProcessor processor = new BoundsProcessor(inner);

        assertThat(processor.multiDim()).isTrue();
        processor.pointBegin(0);
        processor.coordinate(-3, 8, 1.5, null, null, null, 0);
        processor.pointEnd(0);

        assertThat(inner.events()).containsExactly(
                "pointBegin(0)",
                "coordinate(-3.0, 8.0, 1.5, null, null, null, 0)",
                "pointEnd(0)");
        assertThat(processor.bounds()).contains(new Bounds(-3, 8, -3, 8));
    }

    @Test
    void resetForgetsCoordinates() throws Exception {
        BoundsProcessor processor = new BoundsProcessor();
        processor.pointBegin(0);
        processor.xy(1, 1, 0);
        processor.pointEnd(0);

        processor.reset();

        assertThat(processor.bounds()).isEmpty();
    }

    @Test
    void ignoresEmptyPointCoordinates() throws Exception {
        BoundsProcessor processor = new BoundsProcessor();

        processor.multiPointBegin(2, 0);
        processor.xy(Double.NaN, Double.NaN, 0);
        processor.xy(4, 2, 1);
        processor.multiPointEnd(0);

        assertThat(processor.bounds()).contains(Bounds.of(4, 2));
    }
}
