package com.example.i18n.web;

import com.example.i18n.example.ExampleApplication;
import com.example.i18n.resolve.MessageResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = ExampleApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class I18nResponderIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MessageResolver messageResolver;

    @AfterEach
    void restoreDefaultLanguage() {
        messageResolver.setDefaultLanguage("zh-CN");
    }

    @Test
    void testBusy_DebugModeReportsError() throws Exception {
        mockMvc.perform(get("/busy"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.code").value(-1))
                .andExpect(jsonPath("$.msg").value("系统繁忙"))
                .andExpect(jsonPath("$.data").value("busy"))
                .andExpect(jsonPath("$.trace.id").value(""))
                .andExpect(jsonPath("$.trace.desc").value("busy... "))
                .andExpect(request().attribute(I18nResponder.RESPONSE_CODE_ATTRIBUTE, -1));
    }

    @Test
    void testPlainCodes() throws Exception {
        mockMvc.perform(get("/ok"))
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.msg").value("ok"))
                .andExpect(jsonPath("$.data").value("ok"))
                .andExpect(jsonPath("$.trace.desc").value(""));

        mockMvc.perform(get("/fail"))
                .andExpect(jsonPath("$.code").value(500))
                .andExpect(jsonPath("$.msg").value("fail"));

        mockMvc.perform(get("/params"))
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.msg").value("请求参数错误"))
                .andExpect(jsonPath("$.data").value("params"));
    }

    @Test
    void testTemplateParams() throws Exception {
        mockMvc.perform(get("/test"))
                .andExpect(jsonPath("$.code").value(1000))
                .andExpect(jsonPath("$.msg").value("你好,Seakee!你的账号是:18888888888"))
                .andExpect(jsonPath("$.data").value("test"));
    }

    @Test
    void testLanguageHeaderAndUserAgent() throws Exception {
        mockMvc.perform(get("/test").header("lang", "en-US"))
                .andExpect(jsonPath("$.msg").value("Hello,Seakee! Your id is:18888888888"));

        mockMvc.perform(get("/busy").header("User-Agent", "ExampleApp/1.0; Lang=en-US"))
                .andExpect(jsonPath("$.msg").value("System busy"));

        mockMvc.perform(get("/busy").header("lang", "fr-FR"))
                .andExpect(jsonPath("$.msg").value("系统繁忙"));
    }

    @Test
    void testDefaultLanguageSwitch() throws Exception {
        messageResolver.setDefaultLanguage("en-US");

        mockMvc.perform(get("/params"))
                .andExpect(jsonPath("$.msg").value("Request parameter error"));
    }

    @Test
    void testTraceIdFromRequestAttribute() throws Exception {
        mockMvc.perform(get("/ok").requestAttr("trace_id", "abc-123"))
                .andExpect(jsonPath("$.trace.id").value("abc-123"));
    }

    @Test
    void testXml() throws Exception {
        MvcResult result = mockMvc.perform(get("/xml/busy"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_XML))
                .andReturn();

        String body = result.getResponse().getContentAsString(StandardCharsets.UTF_8);
        assertThat(body).contains("<response>");
        assertThat(body).contains("<msg>系统繁忙</msg>");
        assertThat(body).contains("<desc>busy... </desc>");
    }

    @Test
    void testJsonp() throws Exception {
        MvcResult result = mockMvc.perform(get("/jsonp/fail").param("callback", "handle"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("application/javascript"))
                .andReturn();

        String body = result.getResponse().getContentAsString(StandardCharsets.UTF_8);
        assertThat(body).startsWith("handle({\"code\":500,\"msg\":\"fail\"");
        assertThat(body).endsWith(");");
    }

    @Test
    void testYaml() throws Exception {
        MvcResult result = mockMvc.perform(get("/yaml/params").header("lang", "en-US"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("application/x-yaml"))
                .andReturn();

        String body = result.getResponse().getContentAsString(StandardCharsets.UTF_8);
        assertThat(body).contains("code: 400");
        assertThat(body).contains("msg: \"Request parameter error\"");
    }

    @Test
    void testAsciiJson() throws Exception {
        MvcResult result = mockMvc.perform(get("/ascii/test"))
                .andExpect(jsonPath("$.msg").value("你好,Seakee!你的账号是:18888888888"))
                .andReturn();

        byte[] body = result.getResponse().getContentAsByteArray();
        for (byte b : body) {
            assertThat(b).isNotNegative();
        }
    }

    @Test
    void testPureJson() throws Exception {
        MvcResult result = mockMvc.perform(get("/pure/ok")).andReturn();

        assertThat(result.getResponse().getContentAsString(StandardCharsets.UTF_8)).contains("\"<p>ok</p>\"");
    }

    @Test
    void testResponseCodeException() throws Exception {
        mockMvc.perform(get("/users/missing").header("lang", "en-US"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(1000))
                .andExpect(jsonPath("$.msg").value("Hello,nobody! Your id is:0"))
                .andExpect(jsonPath("$.trace.desc").value("user lookup returned nothing"));
    }

    @Test
    void testUnexpectedException() throws Exception {
        mockMvc.perform(get("/crash"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(500))
                .andExpect(jsonPath("$.msg").value("fail"))
                .andExpect(jsonPath("$.trace.desc").value("database unreachable"));
    }

    @Test
    void testValidationFailure() throws Exception {
        mockMvc.perform(post("/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.msg").value("请求参数错误"))
                .andExpect(jsonPath("$.trace.desc").value(startsWith("name ")));
    }

    @Test
    void testMethodNotAllowedUsesStatusAsCode() throws Exception {
        mockMvc.perform(post("/ok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(405))
                .andExpect(jsonPath("$.msg").value("405"));
    }
}
