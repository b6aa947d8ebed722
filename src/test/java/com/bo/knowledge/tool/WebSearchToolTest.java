package com.bo.knowledge.tool;

import com.bo.knowledge.model.ExecutionOutcome;
import com.bo.knowledge.model.Query;
import com.bo.knowledge.model.ToolNames;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebSearchToolTest {

    private static final String URL = "https://api.tavily.com/search";

    @Test
    void offlineAnswersKnownTopics() {
        WebSearchTool tool = new WebSearchTool("", URL, 3);

        ExecutionOutcome outcome = tool.run(Query.of("What is the healthcare policy of Bangladesh?"));

        assertThat(tool.name()).isEqualTo(ToolNames.WEB_SEARCH);
        assertThat(tool.isOnline()).isFalse();
        assertThat(outcome.isUsable()).isTrue();
        assertThat(outcome.getRawResult()).contains("Healthcare Policy");
    }

    @Test
    void offlineFailsUnknownTopics() {
        WebSearchTool tool = new WebSearchTool(null, URL, 3);

        ExecutionOutcome outcome = tool.run(Query.of("Who won the cricket match yesterday?"));

        assertThat(outcome.isSuccess()).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void onlineFormatsResults() throws Exception {
        HttpClient client = mock(HttpClient.class);
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"results\":["
                + "{\"title\":\"Inflation in Bangladesh\",\"url\":\"https://example.org/a\",\"content\":\"Prices rose.\"},"
                + "{\"title\":\"Central bank policy\",\"url\":\"https://example.org/b\",\"content\":\"Rates went up.\"}]}");
        doReturn(response).when(client).send(any(), any());
        WebSearchTool tool = new WebSearchTool("key", URL, 3, client);

        ExecutionOutcome outcome = tool.run(Query.of("Impact of inflation"));

        assertThat(outcome.isUsable()).isTrue();
        assertThat(outcome.getRawResult())
                .contains("1. Inflation in Bangladesh")
                .contains("Source: https://example.org/b");
    }

    @Test
    @SuppressWarnings("unchecked")
    void onlineErrorsBecomeFailures() throws Exception {
        HttpClient client = mock(HttpClient.class);
        HttpResponse<String> unauthorized = mock(HttpResponse.class);
        when(unauthorized.statusCode()).thenReturn(401);
        doReturn(unauthorized).when(client).send(any(), any());

        assertThat(new WebSearchTool("key", URL, 3, client).run(Query.of("inflation")).isSuccess()).isFalse();

        HttpClient down = mock(HttpClient.class);
        doThrow(new IOException("connection refused")).when(down).send(any(), any());

        ExecutionOutcome outcome = new WebSearchTool("key", URL, 3, down).run(Query.of("inflation"));
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getRawResult()).contains("connection refused");
    }

    @Test
    @SuppressWarnings("unchecked")
    void onlineWithoutResultsIsEmpty() throws Exception {
        HttpClient client = mock(HttpClient.class);
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"results\":[]}");
        doReturn(response).when(client).send(any(), any());

        ExecutionOutcome outcome = new WebSearchTool("key", URL, 3, client).run(Query.of("nothing"));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isResultEmpty()).isTrue();
    }
}
