package com.example.livesession;

import com.example.livesession.controller.SessionController;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LiveSessionApplicationTests {

    @Autowired
    private TestRestTemplate rest;

    @Test
    void healthEndpointsRespond() {
        assertEquals("ok", rest.getForObject("/healthz", String.class));

        JsonNode admin = rest.getForObject("/admin/health", JsonNode.class);
        assertEquals("disabled", admin.get("sessionArchive").asText());
    }

    @Test
    void createStartAndLookUpOverRest() {
        HttpHeaders json = new HttpHeaders();
        json.setContentType(MediaType.APPLICATION_JSON);
        String body = """
                {"name":"Smoke","questions":[
                  {"type":"ShortAnswer","text":"Capital of Austria?","acceptedAnswers":["Vienna","Wien"]}]}
                """;

        ResponseEntity<JsonNode> created = rest.postForEntity("/api/sessions", new HttpEntity<>(body, json), JsonNode.class);
        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        String id = created.getBody().at("/session/id").asText();
        String code = created.getBody().at("/session/code").asText();
        String key = created.getBody().get("presenterKey").asText();

        HttpHeaders presenter = new HttpHeaders();
        presenter.set(SessionController.PRESENTER_KEY, key);
        ResponseEntity<JsonNode> started = rest.exchange("/api/sessions/" + id + "/start", HttpMethod.POST,
                new HttpEntity<>(presenter), JsonNode.class);
        assertEquals("Running", started.getBody().get("status").asText());

        JsonNode byCode = rest.getForObject("/api/sessions/code/" + code, JsonNode.class);
        assertEquals(id, byCode.get("id").asText());

        ResponseEntity<JsonNode> noKey = rest.postForEntity("/api/sessions/" + id + "/pause", null, JsonNode.class);
        assertEquals(HttpStatus.FORBIDDEN, noKey.getStatusCode());
    }
}
