package logq.engine.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import logq.engine.types.Value;

public class FieldDecodersTest {

    @Test
    void dashAndEmptyAreNull() {
        for (DataType type : DataType.values()) {
            if (type == DataType.NULL) continue;
            assertTrue(FieldDecoders.forType(type).decode("-").isNull(), type.name());
            assertTrue(FieldDecoders.forType(type).decode("").isNull(), type.name());
        }
    }

    @Test
    void unparsedElbRequestIsNull() {
        assertTrue(FieldDecoders.HTTP_REQUEST.decode("- - - ").isNull());
    }

    @Test
    void clfTimestampKeepsOffset() {
        Value v = FieldDecoders.CLF_TIMESTAMP.decode("06/Feb/2019:00:00:38 +0200");
        assertEquals(Value.of(OffsetDateTime.of(2019, 2, 6, 0, 0, 38, 0, ZoneOffset.ofHours(2))), v);
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.INT.decode("12x"));
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.FLOAT.decode("fast"));
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.BOOLEAN.decode("yes"));
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.ISO_TIMESTAMP.decode("2015-05-13"));
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.EPOCH_SECONDS.decode("noon"));
    }

    @Test
    void floatMustBeFinite() {
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.FLOAT.decode("Infinity"));
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.FLOAT.decode("-Infinity"));
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.FLOAT.decode("NaN"));
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.FLOAT.decode("1e400"));
        assertEquals(Value.of(0.5d), FieldDecoders.FLOAT.decode("0.5"));
    }

    @Test
    void epochSecondsOutsideInstantRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.EPOCH_SECONDS.decode("99999999999999999.000"));
        assertThrows(IllegalArgumentException.class, () -> FieldDecoders.EPOCH_SECONDS.decode("1e30"));
    }
}
