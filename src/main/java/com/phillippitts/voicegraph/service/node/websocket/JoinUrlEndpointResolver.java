package com.phillippitts.voicegraph.service.node.websocket;

import com.phillippitts.voicegraph.exception.TransportException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Requests a join URL from a control-plane endpoint before the socket is opened.
 *
 * <p>Sends {@code POST <controlPlaneUrl>} with a JSON body and expects a JSON response
 * carrying {@code joinUrl}. The URL is cached until {@link #invalidate()} is called, so
 * reconnecting reuses the same call.
 */
public class JoinUrlEndpointResolver implements EndpointResolver {

    private static final Logger LOG = LogManager.getLogger(JoinUrlEndpointResolver.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final URI controlPlaneUrl;
    private final Map<String, String> headers;
    private final JSONObject requestBody;
    private volatile URI cachedJoinUrl;

    public JoinUrlEndpointResolver(OkHttpClient client, URI controlPlaneUrl,
                                   Map<String, String> headers, JSONObject requestBody) {
        this.client = Objects.requireNonNull(client, "client");
        this.controlPlaneUrl = Objects.requireNonNull(controlPlaneUrl, "controlPlaneUrl");
        this.headers = headers == null ? Map.of() : new LinkedHashMap<>(headers);
        this.requestBody = requestBody == null ? new JSONObject() : new JSONObject(requestBody.toString());
    }

    @Override
    public URI resolve(URI configuredEndpoint) {
        URI cached = cachedJoinUrl;
        if (cached != null) {
            return cached;
        }
        synchronized (this) {
            if (cachedJoinUrl == null) {
                cachedJoinUrl = requestJoinUrl();
            }
            return cachedJoinUrl;
        }
    }

    /**
     * Forgets the cached join URL; the next resolve starts a new session.
     */
    public void invalidate() {
        cachedJoinUrl = null;
    }

    private URI requestJoinUrl() {
        Request.Builder builder = new Request.Builder()
                .url(controlPlaneUrl.toString())
                .post(RequestBody.create(requestBody.toString(), JSON));
        headers.forEach(builder::header);

        try (Response response = client.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String payload = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new TransportException("Session setup failed with HTTP " + response.code()
                        + " from " + controlPlaneUrl);
            }
            String joinUrl = new JSONObject(payload).optString("joinUrl", "");
            if (joinUrl.isBlank()) {
                throw new TransportException("Session setup response from " + controlPlaneUrl + " has no joinUrl");
            }
            LOG.info("Obtained join URL from {}", controlPlaneUrl);
            return URI.create(joinUrl);
        } catch (IOException e) {
            throw new TransportException("Session setup request to " + controlPlaneUrl + " failed", e);
        } catch (JSONException | IllegalArgumentException e) {
            throw new TransportException("Invalid session setup response from " + controlPlaneUrl, e);
        }
    }
}
