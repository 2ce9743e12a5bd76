package ch.so.agi.geostream.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;
import ch.so.agi.geostream.GeometryProcessingException;
import ch.so.agi.geostream.RecordingProcessor;
import org.junit.jupiter.api.Test;

class BboxFilterTest {
    private static final Bounds FILTER = new Bounds(0, 0, 10, 10);

    @Test
    void forwardsIntersectingGeometries() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        BboxFilter filter = new BboxFilter(FILTER, recorder);

        line(filter, 5, 5, 20, 20);

        assertThat(filter.passed()).isEqualTo(1);
        assertThat(filter.rejected()).isZero();
        assertThat(recorder.events()).containsExactly(
                "lineStringBegin(true, 2, 0)",
                "xy(5.0, 5.0, 0)",
                "xy(20.0, 20.0, 1)",
                "lineStringEnd(true, 0)");
    }

    @Test
    void dropsDisjointGeometries() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        BboxFilter filter = new BboxFilter(FILTER, recorder);

        line(filter, 11, 11, 20, 20);
        line(filter, 1, 1, 2, 2);

        assertThat(filter.passed()).isEqualTo(1);
        assertThat(filter.rejected()).isEqualTo(1);
        assertThat(recorder.events()).first().isEqualTo("lineStringBegin(true, 2, 0)");
        assertThat(recorder.events()).contains("xy(1.0, 1.0, 0)").doesNotContain("xy(11.0, 11.0, 0)");
    }

    @Test
    void touchingBoundaryPasses() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        BboxFilter filter = new BboxFilter(FILTER, recorder);

        filter.pointBegin(0);
        filter.xy(10, 10, 0);
        filter.pointEnd(0);

        assertThat(filter.passed()).isEqualTo(1);
        assertThat(recorder.events()).hasSize(3);
    }

    @Test
    void dropsEmptyGeometries() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        BboxFilter filter = new BboxFilter(FILTER, recorder);

        filter.pointBegin(0);
        filter.pointEnd(0);

        assertThat(filter.rejected()).isEqualTo(1);
        assertThat(recorder.events()).isEmpty();
    }

    @Test
    void decidesOnWholeCollection() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        BboxFilter filter = new BboxFilter(FILTER, recorder);

        filter.geometryCollectionBegin(2, 0);
        filter.pointBegin(0);
        filter.xy(50, 50, 0);
        filter.pointEnd(0);
        filter.pointBegin(1);
        filter.xy(3, 3, 0);
        filter.pointEnd(1);
        filter.geometryCollectionEnd(0);

        assertThat(filter.passed()).isEqualTo(1);
        assertThat(recorder.events()).hasSize(8).contains("xy(50.0, 50.0, 0)");
    }

    @Test
    void rejectsCoordinateOutsideGeometry() {
        BboxFilter filter = new BboxFilter(FILTER, new GeomSink());

        assertThatThrownBy(() -> filter.xy(1, 1, 0))
                .isInstanceOf(GeometryProcessingException.class);
    }

    @Test
    void rejectsUnbalancedEndEvent() {
        BboxFilter filter = new BboxFilter(FILTER, new GeomSink());

        assertThatThrownBy(() -> filter.polygonEnd(true, 0))
                .isInstanceOf(GeometryProcessingException.class);
    }

    @Test
    void resetDropsAbortedGeometry() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        BboxFilter filter = new BboxFilter(FILTER, recorder);

        filter.lineStringBegin(true, 2, 0);
        filter.xy(50, 50, 0);
        filter.reset();

        filter.pointBegin(0);
        filter.xy(5, 5, 0);
        filter.pointEnd(0);

        assertThat(filter.passed()).isEqualTo(1);
        assertThat(recorder.events()).containsExactly("pointBegin(0)", "xy(5.0, 5.0, 0)", "pointEnd(0)");
    }

    @Test
    void continuesAfterDownstreamFault() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();
        GeomProcessor failingOnce = new ForwardingGeomProcessor(recorder) {
            private boolean failed;

            @Override
            public void xy(double x, double y, int idx) throws GeoStreamException {
                if (!failed) {
                    failed = true;
                    throw new GeometryProcessingException("rejected by sink");
                }
                super.xy(x, y, idx);
            }
        };
        BboxFilter filter = new BboxFilter(FILTER, failingOnce);

        assertThatThrownBy(() -> line(filter, 1, 1, 2, 2))
                .isInstanceOf(GeometryProcessingException.class)
                .hasMessage("rejected by sink");

        filter.pointBegin(0);
        filter.xy(5, 5, 0);
        filter.pointEnd(0);

        assertThat(filter.passed()).isEqualTo(2);
        assertThat(recorder.events()).endsWith("pointBegin(0)", "xy(5.0, 5.0, 0)", "pointEnd(0)");
    }

    private static void line(GeomProcessor processor, double x1, double y1, double x2, double y2)
            throws GeoStreamException {
        processor.lineStringBegin(true, 2, 0);
        processor.xy(x1, y1, 0);
        processor.xy(x2, y2, 1);
        processor.lineStringEnd(true, 0);
    }
}
