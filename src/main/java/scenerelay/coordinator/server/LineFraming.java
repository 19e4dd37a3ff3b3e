package scenerelay.coordinator.server;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;

import java.nio.charset.StandardCharsets;

/**
 * Newline-delimited UTF-8 frames, one JSON message per line.
 */
final class LineFraming {

    /** Upper bound for one encoded message. */
    static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private LineFraming() {
    }

    static void install(ChannelPipeline p) {
        p.addLast(new LineBasedFrameDecoder(MAX_FRAME_BYTES));
        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
    }

    static String frame(String json) {
        return json + "\n";
    }
}
