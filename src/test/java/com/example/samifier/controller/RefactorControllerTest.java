package com.example.samifier.controller;

import com.example.samifier.TestTemplates;
import com.example.samifier.exception.FoldAmbiguousException;
import com.example.samifier.exception.LintFailedException;
import com.example.samifier.exception.OutputWriteException;
import com.example.samifier.exception.TemplateParseException;
import com.example.samifier.model.OutputFormat;
import com.example.samifier.model.RefactorTarget;
import com.example.samifier.model.TemplateRefactorRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST preview endpoint against the full application context
 */
@SpringBootTest
@AutoConfigureMockMvc
public class RefactorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    public void testRefactorInlineTemplate() throws Exception {
        TemplateRefactorRequest request = TemplateRefactorRequest.builder()
                .template(TestTemplates.read("/templates/scenario-a-inline-function.json"))
                .target(RefactorTarget.SAM)
                .outputFormat(OutputFormat.JSON)
                .build();

        mockMvc.perform(post("/api/templates/refactor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.template").value(containsString("\"AWS::Serverless::Function\"")))
                .andExpect(jsonPath("$.plan.source").value("inline"))
                .andExpect(jsonPath("$.plan.folds[0].rule").value("function"))
                .andExpect(jsonPath("$.plan.folds[0].consumedIds", hasSize(2)));
    }

    @Test
    public void testParseErrorIsBadRequest() throws Exception {
        TemplateRefactorRequest request = TemplateRefactorRequest.builder().template("{\"Resources\": [}").build();

        mockMvc.perform(post("/api/templates/refactor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(TemplateParseException.CODE));
    }

    @Test
    public void testMissingTemplateIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/templates/refactor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\": \"SAM\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SOURCE_UNAVAILABLE"))
                .andExpect(jsonPath("$.description").value("Request has no template"));
    }

    @Test
    public void testListRules() throws Exception {
        mockMvc.perform(get("/api/templates/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(9)))
                .andExpect(jsonPath("$[0].name").value("function"))
                .andExpect(jsonPath("$[0].priority").value(10));
    }

    @Test
    public void testStatusMapping() {
        assertEquals(HttpStatus.CONFLICT, RefactorController.statusFor(FoldAmbiguousException.CODE));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, RefactorController.statusFor(LintFailedException.CODE));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, RefactorController.statusFor(OutputWriteException.CODE));
    }
}
