package com.phillippitts.voxbank.service.generation;

import com.phillippitts.voxbank.config.properties.ProviderProperties;
import com.phillippitts.voxbank.exception.SynthesisExceptionBuilder;
import com.phillippitts.voxbank.service.audio.AudioFormat;
import com.phillippitts.voxbank.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Objects;

/**
 * {@link SynthesisProvider} backed by an HTTP text-to-speech endpoint.
 *
 * <p>Request: {@code POST <base-url><synthesize-path>} with a JSON body
 * {@code {"text", "voice", "sampleRateHz", "channels", "format": "pcm_s16le"}} and an optional
 * bearer token. The response body is the audio payload (raw PCM or WAV).
 *
 * <p>Rate limiting (429), upstream 5xx and I/O failures are reported as retryable;
 * other client errors are not.
 */
public class HttpSynthesisProvider implements SynthesisProvider {

    private static final Logger LOG = LogManager.getLogger(HttpSynthesisProvider.class);
    private static final String NAME = "http";

    private final RestClient restClient;
    private final ProviderProperties properties;

    public HttpSynthesisProvider(RestClient restClient, ProviderProperties properties) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public byte[] synthesizeWord(String word, String voiceId) {
        long start = System.nanoTime();
        try {
            byte[] body = restClient.post()
                    .uri(properties.getSynthesizePath())
                    .headers(this::setHeaders)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody(word, voiceId))
                    .retrieve()
                    .body(byte[].class);
            long elapsedMs = TimeUtils.elapsedMillis(start);
            if (body == null || body.length == 0) {
                throw SynthesisExceptionBuilder.create("Provider returned an empty body")
                        .word(word)
                        .voice(voiceId)
                        .durationMs(elapsedMs)
                        .build();
            }
            LOG.debug("Provider call ok: voice={}, bytes={}, durationMs={}", voiceId, body.length, elapsedMs);
            return body;
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw SynthesisExceptionBuilder.create("Provider rejected request")
                    .word(word)
                    .voice(voiceId)
                    .status(status)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .retryable(status == 429 || e.getStatusCode().is5xxServerError())
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw SynthesisExceptionBuilder.create("Provider unreachable")
                    .word(word)
                    .voice(voiceId)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .retryable(true)
                    .metadata("error", e.getClass().getSimpleName())
                    .cause(e)
                    .build();
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    private void setHeaders(HttpHeaders headers) {
        headers.setAccept(List.of(MediaType.APPLICATION_OCTET_STREAM, MediaType.parseMediaType("audio/wav")));
        String apiKey = properties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
    }

    private static String requestBody(String word, String voiceId) {
        JSONObject json = new JSONObject();
        json.put("text", word);
        json.put("voice", voiceId);
        json.put("sampleRateHz", AudioFormat.SAMPLE_RATE);
        json.put("channels", AudioFormat.CHANNELS);
        json.put("format", "pcm_s16le");
        return json.toString();
    }
}
