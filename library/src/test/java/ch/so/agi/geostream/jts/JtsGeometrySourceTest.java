package ch.so.agi.geostream.jts;

import static org.assertj.core.api.Assertions.assertThat;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.RecordingProcessor;
import ch.so.agi.geostream.wkb.Wkb;
import ch.so.agi.geostream.wkb.WkbDialect;
import ch.so.agi.geostream.wkb.WkbWriteOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ByteOrderValues;
import org.locationtech.jts.io.WKBWriter;
import org.locationtech.jts.io.WKTReader;

class JtsGeometrySourceTest {
    private final WKTReader wktReader = new WKTReader();

    @ParameterizedTest
    @ValueSource(strings = {
            "POINT (10 -20)",
            "LINESTRING (0 0, 1 1, 2 0)",
            "POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0), (2 2, 2 4, 4 4, 2 2))",
            "MULTIPOINT ((1 2), (3 4))",
            "MULTILINESTRING ((0 0, 1 1), (2 2, 3 3, 4 4))",
            "MULTIPOLYGON (((0 0, 1 0, 0 1, 0 0)), ((5 5, 6 5, 5 6, 5 5)))",
            "GEOMETRYCOLLECTION (POINT (10 10), LINESTRING (15 15, 20 20))"
    })
    void encodesLikeJts(String wkt) throws Exception {
        Geometry geometry = wktReader.read(wkt);

        byte[] wkb = Wkb.encode(new JtsGeometrySource(geometry), WkbDialect.WKB);

        assertThat(wkb).isEqualTo(new WKBWriter(2, ByteOrderValues.LITTLE_ENDIAN).write(geometry));
    }

    @Test
    void encodesZLikeJts() throws Exception {
        Geometry geometry = wktReader.read("LINESTRING Z (0 0 1, 1 1 2, 2 0 3)");
        WkbWriteOptions options = WkbWriteOptions.builder().dimensions(CoordDimensions.xyz()).build();

        byte[] wkb = Wkb.encode(new JtsGeometrySource(geometry), WkbDialect.EWKB, options);

        assertThat(wkb).isEqualTo(new WKBWriter(3, ByteOrderValues.LITTLE_ENDIAN).write(geometry));
    }

    @Test
    void emitsRingsUntagged() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();

        new JtsGeometrySource(wktReader.read("POLYGON ((0 0, 1 0, 0 1, 0 0))")).process(recorder);

        assertThat(recorder.events()).containsExactly(
                "polygonBegin(true, 1, 0)",
                "lineStringBegin(false, 4, 0)",
                "xy(0.0, 0.0, 0)",
                "xy(1.0, 0.0, 1)",
                "xy(0.0, 1.0, 2)",
                "xy(0.0, 0.0, 3)",
                "lineStringEnd(false, 0)",
                "polygonEnd(true, 0)");
    }

    @Test
    void deliversMissingZAsNull() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor(CoordDimensions.xyz());

        new JtsGeometrySource(wktReader.read("POINT (1 2)")).process(recorder);

        assertThat(recorder.events()).containsExactly(
                "pointBegin(0)", "coordinate(1.0, 2.0, null, null, null, null, 0)", "pointEnd(0)");
    }

    @Test
    void emitsEmptyPointWithoutCoordinate() throws Exception {
        RecordingProcessor recorder = new RecordingProcessor();

        new JtsGeometrySource(wktReader.read("POINT EMPTY")).process(recorder);

        assertThat(recorder.events()).containsExactly("pointBegin(0)", "pointEnd(0)");
    }
}
