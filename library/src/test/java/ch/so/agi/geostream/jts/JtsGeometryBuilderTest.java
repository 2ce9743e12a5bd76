package ch.so.agi.geostream.jts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.GeometryProcessingException;
import ch.so.agi.geostream.wkb.Wkb;
import ch.so.agi.geostream.wkb.WkbDialect;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.WKTReader;

class JtsGeometryBuilderTest {
    private final GeometryFactory factory = new GeometryFactory();
    private final WKTReader wktReader = new WKTReader(factory);

    @ParameterizedTest
    @ValueSource(strings = {
            "POINT (10 -20)",
            "POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0), (2 2, 2 4, 4 4, 2 2))",
            "MULTIPOINT ((1 2), (3 4))",
            "MULTILINESTRING ((0 0, 1 1), (2 2, 3 3, 4 4))",
            "MULTIPOLYGON (((0 0, 1 0, 0 1, 0 0)), ((5 5, 6 5, 5 6, 5 5)))",
            "GEOMETRYCOLLECTION (POINT (10 10), LINESTRING (15 15, 20 20), POLYGON ((0 0, 1 0, 0 1, 0 0)))"
    })
    void rebuildsGeometryFromWkb(String wkt) throws Exception {
        Geometry expected = wktReader.read(wkt);
        byte[] wkb = Wkb.encode(new JtsGeometrySource(expected), WkbDialect.WKB);
        JtsGeometryBuilder builder = new JtsGeometryBuilder(factory);

        Wkb.decode(wkb, WkbDialect.WKB, builder);

        assertThat(builder.geometry().equalsExact(expected)).isTrue();
    }

    @Test
    void keepsZ() throws Exception {
        JtsGeometryBuilder builder = new JtsGeometryBuilder(factory, CoordDimensions.xyz());

        Wkb.decode(HexFormat.of().parseHex(
                "01010000A0E6100000000000000000244000000000000034C00000000000005940"), WkbDialect.EWKB, builder);

        Point point = (Point) builder.geometry();
        assertThat(point.getX()).isEqualTo(10.0);
        assertThat(point.getY()).isEqualTo(-20.0);
        assertThat(point.getCoordinate().getZ()).isEqualTo(100.0);
    }

    @Test
    void buildsPolygonShellAsLinearRing() throws Exception {
        JtsGeometryBuilder builder = new JtsGeometryBuilder(factory);

        new JtsGeometrySource(wktReader.read("POLYGON ((0 0, 1 0, 0 1, 0 0))")).process(builder);

        Polygon polygon = (Polygon) builder.geometry();
        assertThat(polygon.getExteriorRing().isClosed()).isTrue();
        assertThat(polygon.getNumInteriorRing()).isZero();
    }

    @Test
    void buildsEmptyPoint() throws Exception {
        JtsGeometryBuilder builder = new JtsGeometryBuilder(factory);

        Wkb.decode(HexFormat.of().parseHex("0101000000000000000000f87f000000000000f87f"), WkbDialect.WKB, builder);

        assertThat(builder.geometry()).isInstanceOf(Point.class);
        assertThat(builder.geometry().isEmpty()).isTrue();
    }

    @Test
    void rejectsCurves() {
        JtsGeometryBuilder builder = new JtsGeometryBuilder(factory);
        byte[] circularString = HexFormat.of().parseHex("01080000000300000000000000000000000000000000000000000000"
                + "000000F03F000000000000F03F00000000000000400000000000000000");

        assertThatThrownBy(() -> Wkb.decode(circularString, WkbDialect.EWKB, builder))
                .isInstanceOf(GeometryProcessingException.class)
                .hasMessageContaining("CircularString");
    }

    @Test
    void wrapsInvalidRing() {
        JtsGeometryBuilder builder = new JtsGeometryBuilder(factory);

        assertThatThrownBy(() -> {
            builder.polygonBegin(true, 1, 0);
            builder.lineStringBegin(false, 2, 0);
            builder.xy(0, 0, 0);
            builder.xy(1, 1, 1);
            builder.lineStringEnd(false, 0);
        }).isInstanceOf(GeometryProcessingException.class);
    }

    @Test
    void rejectsUnbalancedEvents() {
        JtsGeometryBuilder builder = new JtsGeometryBuilder(factory);

        assertThatThrownBy(() -> builder.xy(1, 2, 0)).isInstanceOf(GeometryProcessingException.class);
        assertThatThrownBy(() -> builder.lineStringEnd(true, 0)).isInstanceOf(GeometryProcessingException.class);
    }

    @Test
    void keepsLastTopLevelGeometry() throws Exception {
        JtsGeometryBuilder builder = new JtsGeometryBuilder(factory);

        new JtsGeometrySource(wktReader.read("POINT (1 1)")).process(builder);
        new JtsGeometrySource(wktReader.read("LINESTRING (0 0, 2 2)")).process(builder);

        assertThat(builder.geometry()).isInstanceOf(LineString.class);
    }
}
