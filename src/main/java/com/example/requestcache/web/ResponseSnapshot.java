package com.example.requestcache.web;

import com.example.requestcache.core.SizedValue;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.http.HttpHeaders;

/**
 * Captured status, headers and body of a response, replayable on a later request.
 * The body is copied on the way in and on the way out, so a stored snapshot never changes.
 */
public record ResponseSnapshot(int status, Map<String, List<String>> headers, String contentType, byte[] body)
    implements SizedValue {

    // written from the body and the content type on replay, or tied to the original client
    private static final Set<String> SKIPPED_HEADERS = skippedHeaders();

    public ResponseSnapshot {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body.clone();
    }

    public static ResponseSnapshot capture(HttpServletResponse response, byte[] body) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : response.getHeaderNames()) {
            if (SKIPPED_HEADERS.contains(name)) {
                continue;
            }
            Collection<String> values = response.getHeaders(name);
            headers.putIfAbsent(name, List.copyOf(values));
        }
        return new ResponseSnapshot(response.getStatus(), headers, response.getContentType(), body);
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public void replay(HttpServletResponse response) throws IOException {
        response.setStatus(status);
        headers.forEach((name, values) -> values.forEach(value -> response.addHeader(name, value)));
        if (contentType != null) {
            response.setContentType(contentType);
        }
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
        response.flushBuffer();
    }

    @Override
    public long estimatedBytes() {
        long bytes = body.length;
        for (Map.Entry<String, List<String>> header : headers.entrySet()) {
            bytes += header.getKey().length() * 2L;
            for (String value : header.getValue()) {
                bytes += value.length() * 2L;
            }
        }
        return contentType != null ? bytes + contentType.length() * 2L : bytes;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ResponseSnapshot that)) {
            return false;
        }
        return status == that.status
            && headers.equals(that.headers)
            && Objects.equals(contentType, that.contentType)
            && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(status, headers, contentType) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "ResponseSnapshot[status=" + status + ", contentType=" + contentType + ", bodyLength=" + body.length + "]";
    }

    private static Set<String> skippedHeaders() {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.add(HttpHeaders.CONTENT_TYPE);
        names.add(HttpHeaders.CONTENT_LENGTH);
        names.add(HttpHeaders.TRANSFER_ENCODING);
        names.add(HttpHeaders.SET_COOKIE);
        return names;
    }
}
