package io.edgeway.core.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RequestEnvelopeBuilderTest {
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final RequestEnvelopeBuilder builder =
        new RequestEnvelopeBuilder(new ObjectMapper(), Duration.ofMillis(200), executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldParseJsonObjectBody() throws Exception {
        StubRequest request = StubRequest.of("POST", "/api/v1/content/parse")
            .json("{\"name\":\"report\",\"pages\":3}")
            .query("verbose", "true");

        RequestEnvelope envelope = builder.build(request, "/api/v1/content/parse", "content", "parse");

        assertThat(envelope.method()).isEqualTo("POST");
        assertThat(envelope.body()).containsEntry("name", "report").containsEntry("pages", 3);
        assertThat(envelope.queryParams()).containsEntry("verbose", "true");
        assertThat(envelope.route()).isEqualTo("content/parse");
        assertThat(envelope.authContext()).isNull();
    }

    @Test
    void absentOrNullBodyIsNotAnError() throws Exception {
        RequestEnvelope empty = builder.build(StubRequest.of("POST", "/x"), "/api/v1/a/b", "a", "b");
        RequestEnvelope nullJson = builder.build(StubRequest.of("PUT", "/x").json("null"), "/api/v1/a/b", "a", "b");

        assertThat(empty.body()).isEmpty();
        assertThat(nullJson.body()).isEmpty();
    }

    @Test
    void getRequestsNeverReadTheBody() throws Exception {
        StubRequest request = StubRequest.of("GET", "/x").body(() -> {
            throw new AssertionError("body must not be read");
        });

        RequestEnvelope envelope = builder.build(request, "/api/v1/a/b", "a", "b");

        assertThat(envelope.body()).isEmpty();
    }

    @Test
    void invalidOrNonObjectJsonIsMalformed() {
        assertThatThrownBy(() -> builder.build(StubRequest.of("POST", "/x").json("{broken"), "/e", "a", "b"))
            .isInstanceOf(MalformedRequestException.class)
            .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> builder.build(StubRequest.of("POST", "/x").json("[1,2]"), "/e", "a", "b"))
            .isInstanceOf(MalformedRequestException.class)
            .hasMessageContaining("JSON object");
    }

    @Test
    void stalledBodyTimesOutAsMalformed() {
        CountDownLatch never = new CountDownLatch(1);
        StubRequest request = StubRequest.of("POST", "/x").json("{}").body(() -> new InputStream() {
            @Override
            public int read() throws InterruptedIOException {
                try {
                    never.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("cancelled");
                }
                return -1;
            }
        });

        long started = System.nanoTime();
        assertThatThrownBy(() -> builder.build(request, "/e", "a", "b"))
            .isInstanceOf(MalformedRequestException.class)
            .hasMessageContaining("not received");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void timedOutBodyIsClosedSoTheReaderReturns() throws Exception {
        CountDownLatch closed = new CountDownLatch(1);
        CountDownLatch readerReturned = new CountDownLatch(1);
        StubRequest request = StubRequest.of("POST", "/x").json("{}").body(() -> new InputStream() {
            @Override
            public int read() throws IOException {
                boolean interrupted = false;
                while (closed.getCount() > 0) {
                    try {
                        closed.await();
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
                readerReturned.countDown();
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
                throw new IOException("stream closed");
            }

            @Override
            public void close() {
                closed.countDown();
            }
        });

        assertThatThrownBy(() -> builder.build(request, "/e", "a", "b"))
            .isInstanceOf(MalformedRequestException.class)
            .hasMessageContaining("not received");

        assertThat(closed.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(readerReturned.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void emptyFilePartsAreDroppedButRemembered() throws Exception {
        StubRequest request = StubRequest.of("POST", "/x").multipart(
            FormPart.field("mode", "fast"),
            FormPart.file("file", new FileBlob("empty.csv", new byte[0], "text/csv")),
            FormPart.file("copybook", new FileBlob("layout.cpy", "01 REC.".getBytes(StandardCharsets.UTF_8), null))
        );

        RequestEnvelope envelope = builder.build(request, "/api/v1/content/upload", "content", "upload");

        assertThat(envelope.body()).isEqualTo(Map.of("mode", "fast"));
        assertThat(envelope.files()).containsOnlyKeys("copybook");
        assertThat(envelope.submittedFileFields()).containsExactly("file", "copybook");
        assertThat(envelope.missingMainFile()).isTrue();
        assertThat(envelope.availableFiles()).containsExactly("copybook");
    }

    @Test
    void routerPayloadMirrorsMainFileIntoParams() throws Exception {
        byte[] content = "a,b\n1,2".getBytes(StandardCharsets.UTF_8);
        StubRequest request = StubRequest.of("POST", "/x")
            .header("X-Session-Token", "sess-1")
            .multipart(FormPart.file("file", new FileBlob("data.csv", content, "text/csv")));

        RequestEnvelope envelope = builder.build(request, "/api/v1/content/upload", "content", "upload");
        Map<String, Object> payload = envelope.toRouterPayload();

        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) payload.get("params");
        assertThat(params).containsEntry("filename", "data.csv").containsEntry("content_type", "text/csv");
        assertThat((byte[]) params.get("file_data")).isEqualTo(content);
        assertThat(payload).containsEntry("user_id", "anonymous").containsEntry("session_token", "sess-1");
        assertThat(payload.get("user_context")).isNull();
        assertThat(payload).containsKey("files");
    }
}
