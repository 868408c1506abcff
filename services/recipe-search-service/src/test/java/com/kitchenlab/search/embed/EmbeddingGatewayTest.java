package com.kitchenlab.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class EmbeddingGatewayTest {

    @Test
    void postsModelAndInputWithBearerToken() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties());

        server.expect(requestTo("http://embed.local/v1/embeddings"))
            .andExpect(method(POST))
            .andExpect(header("Authorization", "Bearer sk-test"))
            .andExpect(jsonPath("$.model").value("text-embedding-ada-002"))
            .andExpect(jsonPath("$.input").value("tomato soup"))
            .andRespond(withSuccess(
                "{\"object\":\"list\",\"data\":[{\"index\":0,\"embedding\":[0.25,-0.5]}],\"model\":\"text-embedding-ada-002\"}",
                MediaType.APPLICATION_JSON
            ));

        assertThat(gateway.embed("tomato soup", null)).containsExactly(0.25, -0.5);
        server.verify();
    }

    @Test
    void retriesThenReportsHttpStatus() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingProperties properties = properties();
        properties.setRetryCount(1);
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties);

        server.expect(ExpectedCount.times(2), requestTo("http://embed.local/v1/embeddings"))
            .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> gateway.embed("tomato soup", null))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_429");
        server.verify();
    }

    @Test
    void emptyDataIsUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties());

        server.expect(requestTo("http://embed.local/v1/embeddings"))
            .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embed("tomato soup", null))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_empty_response");
    }

    @Test
    void blankTextIsRejectedLocally() {
        EmbeddingGateway gateway = new EmbeddingGateway(new RestTemplate(), properties());

        assertThatThrownBy(() -> gateway.embed(" ", null)).hasMessage("embed_empty_text");
    }

    private static EmbeddingProperties properties() {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setMode(EmbeddingMode.HTTP);
        properties.setBaseUrl("http://embed.local/");
        properties.setApiKey("sk-test");
        return properties;
    }
}
