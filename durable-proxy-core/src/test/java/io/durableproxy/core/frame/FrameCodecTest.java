package io.durableproxy.core.frame;

import io.durableproxy.core.DurableProxyException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameCodecTest {

    @Test
    void encodesHeaderBigEndian() {
        byte[] bytes = FrameCodec.encode(Frame.data(0x01020304L, "hi".getBytes(StandardCharsets.UTF_8)));

        assertThat(bytes).hasSize(FrameCodec.HEADER_LENGTH + 2);
        assertThat(bytes[0]).isEqualTo((byte) 'D');
        assertThat(bytes[1]).isEqualTo((byte) 0x01);
        assertThat(bytes[4]).isEqualTo((byte) 0x04);
        assertThat(bytes[5]).isZero();
        assertThat(bytes[8]).isEqualTo((byte) 2);
        assertThat(new String(bytes, 9, 2, StandardCharsets.UTF_8)).isEqualTo("hi");
    }

    @Test
    void responseIdIsUnsigned() {
        Frame frame = Frame.complete(FrameCodec.MAX_RESPONSE_ID);

        List<Frame> decoded = FrameCodec.decodeAll(FrameCodec.encode(frame));

        assertThat(decoded).containsExactly(frame);
        assertThat(decoded.get(0).responseId()).isEqualTo(4294967295L);
    }

    @Test
    void decodesInterleavedLifecycles() {
        List<Frame> frames = List.of(
                Frame.start(1, new StartPayload(200, Map.of("content-type", "text/plain"))),
                Frame.start(2, new StartPayload(201, Map.of())),
                Frame.data(1, new byte[]{1, 2, 3}),
                Frame.data(2, new byte[0]),
                Frame.abort(2),
                Frame.complete(1),
                Frame.error(3, new ErrorPayload("boom", "UPSTREAM_ERROR")));

        assertThat(FrameCodec.decodeAll(FrameCodec.encodeAll(frames))).containsExactlyElementsOf(frames);
    }

    @Test
    void truncatedInputIsMalformed() {
        byte[] bytes = FrameCodec.encode(Frame.data(7, new byte[]{1, 2, 3, 4}));
        byte[] truncated = java.util.Arrays.copyOf(bytes, bytes.length - 1);

        assertThatThrownBy(() -> FrameCodec.decodeAll(truncated))
                .isInstanceOf(DurableProxyException.MalformedFrame.class)
                .hasMessageContaining("truncated");
    }

    @Test
    void unknownTypeByteIsFatal() {
        byte[] bytes = FrameCodec.encode(Frame.complete(1));
        bytes[0] = 'X';

        assertThatThrownBy(() -> FrameCodec.decodeAll(bytes))
                .isInstanceOf(DurableProxyException.UnknownFrameType.class)
                .satisfies(e -> assertThat(((DurableProxyException.UnknownFrameType) e).typeByte()).isEqualTo('X'));
    }

    @Test
    void rejectsOutOfRangeResponseId() {
        assertThatThrownBy(() -> Frame.complete(FrameCodec.MAX_RESPONSE_ID + 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Frame.complete(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
