package me.golemcore.agentkernel.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp exchange engine for model client tests.
 * <p>
 * No network I/O happens: tests script chat-completion replies (or transport
 * failures) and inspect every captured request afterwards.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<ScriptedReply> replies = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> requests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public OkHttpClient client() {
        return new OkHttpClient.Builder()
                .addInterceptor(this)
                .build();
    }

    public void enqueueJson(int code, String body) {
        replies.add(new ScriptedReply(code, body != null ? body : "", null));
    }

    public void enqueueFailure(IOException failure) {
        replies.add(new ScriptedReply(0, "", failure));
    }

    public CapturedRequest takeRequest() {
        return requests.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requests.add(new CapturedRequest(request, readBody(request.body())));
        requestCount.incrementAndGet();

        ScriptedReply reply = replies.poll();
        if (reply == null) {
            throw new IOException("No scripted reply for " + request.method() + " " + request.url());
        }
        if (reply.failure() != null) {
            throw reply.failure();
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("mock")
                .body(ResponseBody.create(reply.body(), JSON))
                .build();
    }

    private static String readBody(RequestBody body) throws IOException {
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record ScriptedReply(int code, String body, IOException failure) {
    }

    public record CapturedRequest(Request request, String body) {

        public String method() {
            return request.method();
        }

        public String path() {
            return request.url().encodedPath();
        }

        public String header(String name) {
            return request.header(name);
        }
    }
}
