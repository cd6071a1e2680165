package dev.vigil.infrastructure.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Turns the line-oriented body of an OpenAI-style SSE response into text deltas.
 *
 * <p>Only {@code data: } lines count. {@code data: [DONE]} ends the sequence and cancels
 * the upstream body. Frames that fail to parse are dropped and decoding continues.
 */
public final class StreamDecoder {
    private static final Logger log = LoggerFactory.getLogger(StreamDecoder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String DATA_PREFIX = "data: ";
    static final String DONE = "[DONE]";

    private StreamDecoder() {}

    public static Flux<String> decode(Flux<String> lines) {
        return lines.map(StreamDecoder::decodeLine)
                .takeWhile(frame -> !frame.end())
                .filter(Frame::hasText)
                .map(Frame::text);
    }

    static Frame decodeLine(String line) {
        if (line == null || !line.startsWith(DATA_PREFIX)) return Frame.SKIP;
        String payload = line.substring(DATA_PREFIX.length()).trim();
        if (DONE.equals(payload)) return Frame.END;
        try {
            JsonNode content = MAPPER.readTree(payload).path("choices").path(0).path("delta").path("content");
            return content.isTextual() ? new Frame(content.asText(), false) : Frame.SKIP;
        } catch (JsonProcessingException e) {
            log.debug("Dropping malformed stream frame: {}", e.getOriginalMessage());
            return Frame.SKIP;
        }
    }

    record Frame(String text, boolean end) {
        static final Frame SKIP = new Frame(null, false);
        static final Frame END = new Frame(null, true);

        boolean hasText() {
            return text != null && !text.isEmpty();
        }
    }
}
