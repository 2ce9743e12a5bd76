package ch.so.agi.geostream.wkb;

import static org.assertj.core.api.Assertions.assertThat;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.GeometrySource;
import ch.so.agi.geostream.RecordingProcessor;
import ch.so.agi.geostream.processor.GeomSink;
import java.util.HexFormat;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class WkbRoundTripTest {
    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    static Stream<Arguments> geometries() {
        return Stream.of(
                Arguments.of(WkbDialect.EWKB, CoordDimensions.xy(),
                        "0101000020E6100000000000000000244000000000000034C0"),
                Arguments.of(WkbDialect.EWKB, CoordDimensions.xyz(),
                        "0101000080000000000000F87F000000000000F87F000000000000F87F"),
                Arguments.of(WkbDialect.EWKB, CoordDimensions.xyzm(),
                        "01010000C0000000000000244000000000000034C00000000000005940000000000000F03F"),
                Arguments.of(WkbDialect.EWKB, CoordDimensions.xyz(),
                        "01040000A0E6100000020000000101000080000000000000244000000000000034C0000000000000594001"
                                + "010000800000000000000000000000000000E0BF0000000000405940"),
                Arguments.of(WkbDialect.EWKB, CoordDimensions.xy(),
                        "01070000000300000001010000000000000000002440000000000000244001010000000000000000003E40"
                                + "0000000000003E400102000000020000000000000000002E400000000000002E40000000000000"
                                + "34400000000000003440"),
                Arguments.of(WkbDialect.EWKB, CoordDimensions.xy(),
                        "01090000000200000001080000000300000000000000000000000000000000000000000000000000F03F00"
                                + "0000000000F03F000000000000004000000000000000000102000000020000000000000000000040"
                                + "000000000000000000000000000008400000000000000000"),
                Arguments.of(WkbDialect.WKB, CoordDimensions.xyzm(),
                        "01B90B0000000000000000244000000000000034C00000000000005940000000000000F03F"),
                Arguments.of(WkbDialect.GEOPACKAGE, CoordDimensions.xy(),
                        "47500003E61000009A9999999999F13F9A9999999999F13F9A9999999999F13F9A9999999999F13F0101"
                                + "0000009A9999999999F13F9A9999999999F13F"),
                Arguments.of(WkbDialect.GEOPACKAGE, CoordDimensions.xyzm(),
                        "47500003E610000000000000000024400000000000003440000000000000244000000000000034400"
                                + "1BD0B00000100000001BA0B000002000000000000000000344000000000000024400000000000"
                                + "0008400000000000001440000000000000244000000000000034400000000000001C40000000"
                                + "0000000040"),
                Arguments.of(WkbDialect.SPATIALITE, CoordDimensions.xyzm(),
                        "0001E6100000000000000000244000000000000034C0000000000000244000000000000034C07CB90B0000"
                                + "000000000000244000000000000034C00000000000005940000000000000F03FFE"),
                Arguments.of(WkbDialect.SPATIALITE, CoordDimensions.xyzm(),
                        "00010000000000000000000024400000000000002440000000000000344000000000000034407CBD0B0000"
                                + "0100000069BA0B0000020000000000000000003440000000000000244000000000000014400000"
                                + "00000000F03F000000000000244000000000000034400000000000003E400000000000004440FE"),
                Arguments.of(WkbDialect.SPATIALITE, CoordDimensions.xy(),
                        "000100000000000000000000F03F0000000000000840000000000000364000000000000036407C07000000"
                                + "020000006901000000000000000000F03F0000000000000840690300000001000000040000000000"
                                + "00000000354000000000000035400000000000003640000000000000354000000000000035400000"
                                + "00000000364000000000000035400000000000003540FE"),
                Arguments.of(WkbDialect.MYSQL, CoordDimensions.xy(),
                        "E61000000101000000000000000000244000000000000034C0"),
                Arguments.of(WkbDialect.MYSQL, CoordDimensions.xy(),
                        "00000000010500000001000000010200000002000000000000000000344000000000000024400000000000"
                                + "0024400000000000003440"));
    }

    @ParameterizedTest
    @MethodSource("geometries")
    void reencodesIdentically(WkbDialect dialect, CoordDimensions dimensions, String hex) throws Exception {
        byte[] wkb = HEX.parseHex(hex);
        WkbReader header = Wkb.decode(wkb, dialect, new GeomSink());
        WkbWriteOptions.Builder options = WkbWriteOptions.builder().dimensions(dimensions);
        header.srid().ifPresent(options::srid);
        if (dialect == WkbDialect.GEOPACKAGE) {
            options.envelope(header.envelope());
        }

        byte[] encoded = Wkb.encode(Wkb.source(wkb, dialect), dialect, options.build());

        assertThat(HEX.formatHex(encoded)).isEqualTo(hex);
    }

    @ParameterizedTest
    @MethodSource("geometries")
    void keepsEventsAcrossDialects(WkbDialect dialect, CoordDimensions dimensions, String hex) throws Exception {
        byte[] wkb = HEX.parseHex(hex);
        RecordingProcessor direct = new RecordingProcessor(dimensions);
        Wkb.decode(wkb, dialect, direct);

        WkbWriteOptions options = WkbWriteOptions.builder().dimensions(dimensions).build();
        byte[] ewkb = Wkb.encode(Wkb.source(wkb, dialect), WkbDialect.EWKB, options);
        RecordingProcessor converted = new RecordingProcessor(dimensions);
        Wkb.decode(ewkb, WkbDialect.EWKB, converted);

        assertThat(converted.events()).isEqualTo(direct.events());
    }

    @Test
    void deliversZForEveryCoordinate() throws Exception {
        GeometrySource lineString = p -> {
            p.lineStringBegin(true, 3, 0);
            p.coordinate(0, 0, 1.0, null, null, null, 0);
            p.coordinate(1, 1, 2.0, null, null, null, 1);
            p.coordinate(2, 0, 3.0, null, null, null, 2);
            p.lineStringEnd(true, 0);
        };
        WkbWriteOptions options = WkbWriteOptions.builder().dimensions(CoordDimensions.xyz()).build();

        for (WkbDialect dialect : new WkbDialect[] {
                WkbDialect.WKB, WkbDialect.EWKB, WkbDialect.GEOPACKAGE, WkbDialect.SPATIALITE}) {
            RecordingProcessor recorder = new RecordingProcessor(CoordDimensions.xyz());
            Wkb.decode(Wkb.encode(lineString, dialect, options), dialect, recorder);

            assertThat(recorder.events()).as(dialect.name()).containsExactly(
                    "lineStringBegin(true, 3, 0)",
                    "coordinate(0.0, 0.0, 1.0, null, null, null, 0)",
                    "coordinate(1.0, 1.0, 2.0, null, null, null, 1)",
                    "coordinate(2.0, 0.0, 3.0, null, null, null, 2)",
                    "lineStringEnd(true, 0)");
        }
    }
}
