package com.changeguard.core.vcs;

import com.changeguard.core.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GitHubReviewClientTest {

    private PublishProperties properties;
    private HttpClient httpClient;
    private HttpResponse<String> response;
    private GitHubReviewClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new PublishProperties();
        properties.getGithub().setOwner("acme");
        properties.getGithub().setRepo("shop");
        properties.getGithub().setToken("t0ken");
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        client = new GitHubReviewClient(properties, new ObjectMapper(), httpClient);
    }

    @Test
    @DisplayName("opens a pull request and returns its html_url")
    void opensPullRequest() throws Exception {
        when(response.statusCode()).thenReturn(201);
        when(response.body()).thenReturn("{\"number\":7,\"html_url\":\"https://github.com/acme/shop/pull/7\"}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        String url = client.publishForReview("cleanup/1", "main", "Tidy", "Details");

        assertEquals("https://github.com/acme/shop/pull/7", url);
        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertEquals("https://api.github.com/repos/acme/shop/pulls", request.uri().toString());
        assertEquals("POST", request.method());
        assertEquals("Bearer t0ken", request.headers().firstValue("Authorization").orElseThrow());
    }

    @Test
    @DisplayName("an HTTP error status becomes an ExternalServiceException")
    void httpError() throws Exception {
        when(response.statusCode()).thenReturn(422);
        when(response.body()).thenReturn("{\"message\":\"Validation Failed\"}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        var e = assertThrows(ExternalServiceException.class,
                () -> client.publishForReview("b", "main", "t", null));
        assertTrue(e.getMessage().contains("422"));
    }

    @Test
    @DisplayName("transport failures become ExternalServiceException")
    void ioError() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(ExternalServiceException.class, () -> client.publishForReview("b", "main", "t", ""));
    }

    @Test
    @DisplayName("fails without calling GitHub when owner, repo or token are missing")
    void notConfigured() {
        properties.getGithub().setToken("");

        assertThrows(ExternalServiceException.class, () -> client.publishForReview("b", "main", "t", ""));
        verifyNoInteractions(httpClient);
    }

    @Test
    @DisplayName("a response without html_url is an error")
    void missingUrl() throws Exception {
        when(response.statusCode()).thenReturn(201);
        when(response.body()).thenReturn("{}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(ExternalServiceException.class, () -> client.publishForReview("b", "main", "t", ""));
    }
}
