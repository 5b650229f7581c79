package com.deepproof.tool.fstar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the F* verification service.
 * Uses {@code POST baseUrl/check_problem_solution} with {@code {"solution", "problem_id"}}.
 * <p>
 * One {@link HttpClient} is shared by all calls; each call is bounded by the configured timeout
 * covering connect, send and reading the whole response body. On timeout the exchange is cancelled.
 */
final class FStarVerifierClient {

    private static final Logger log = LoggerFactory.getLogger(FStarVerifierClient.class);

    static final String CHECK_PATH = "/check_problem_solution";
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI endpoint;
    private final Duration timeout;
    private final HttpClient httpClient;

    FStarVerifierClient(String baseUrl, Duration timeout) {
        this.endpoint = URI.create(Objects.requireNonNull(baseUrl, "baseUrl") + CHECK_PATH);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    URI getEndpoint() {
        return endpoint;
    }

    /**
     * Submits a solution for the problem and returns the verifier's reply.
     *
     * @throws VerificationServiceException on non-2xx status or a body that is not a JSON object
     * @throws HttpTimeoutException         when the exchange does not finish within the timeout
     * @throws Exception                    on connection, DNS or JSON parse failures
     */
    VerificationResponse check(String solution, String problemId) throws Exception {
        String json = MAPPER.writeValueAsString(new VerificationRequest(solution, problemId));
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        log.debug("POST {} problem_id={} solutionChars={}", endpoint, problemId, solution.length());
        HttpResponse<String> response = await(
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)));
        int status = response.statusCode();
        String body = response.body();
        if (status < 200 || status >= 300) {
            throw new VerificationServiceException("Verifier error: " + status + " " + truncate(body), status);
        }
        if (body == null || body.isBlank()) {
            throw new VerificationServiceException("Verifier returned an empty body", status);
        }
        JsonNode root = MAPPER.readTree(body);
        if (root == null || !root.isObject()) {
            throw new VerificationServiceException("Verifier response is not a JSON object: " + truncate(body), status);
        }
        return VerificationResponse.fromJson(root);
    }

    private HttpResponse<String> await(CompletableFuture<HttpResponse<String>> future) throws Exception {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HttpTimeoutException("Verification request timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    private static String truncate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_ERROR_BODY_CHARS ? body : body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
