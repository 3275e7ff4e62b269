package com.example.scan2doc.controller;

import com.example.scan2doc.exception.DocGenException;
import com.example.scan2doc.exception.GenerationCancelledException;
import com.example.scan2doc.exception.MissingRawTextException;
import com.example.scan2doc.exception.UnsupportedImageFormatException;
import com.example.scan2doc.service.DocGenService;
import com.example.scan2doc.util.ocr.dto.OcrResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DocGenControllerTest {

    private static final byte[] PNG_HEADER = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
    private static final String OCR_JSON = "{\"raw_text\":\"hello\",\"prompt_type\":\"document\"}";

    @Mock
    private DocGenService docGenService;

    @Spy
    private ObjectMapper objectMapper = new ObjectMapper();

    @InjectMocks
    private DocGenController controller;

    @TempDir
    Path tempDir;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void mapsErrorKindsToStatusCodes() {
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY,
                DocGenController.errorResponse(new MissingRawTextException()).getStatusCode());
        assertEquals(HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                DocGenController.errorResponse(new UnsupportedImageFormatException(null)).getStatusCode());
        assertEquals(HttpStatus.CONFLICT,
                DocGenController.errorResponse(new GenerationCancelledException("PDF")).getStatusCode());

        ResponseEntity<Map<String, Object>> io = DocGenController.errorResponse(
                new DocGenException(DocGenException.ErrorKind.IO_FAILURE, "disk full /secret/path"));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, io.getStatusCode());
        assertEquals(false, io.getBody().get("success"));
        assertEquals("IO_FAILURE", io.getBody().get("kind"));
        assertFalse(String.valueOf(io.getBody().get("message")).contains("/secret/path"));
    }

    @Test
    void acceptsUploadAndStartsGeneration() throws Exception {
        Map<String, Object> task = new HashMap<>();
        task.put("taskId", "abc123");
        when(docGenService.createTask(any(byte[].class), any(OcrResult.class))).thenReturn(task);

        mockMvc.perform(multipart("/api/doc-gen/process")
                        .file(new MockMultipartFile("image", "page.png", "image/png", PNG_HEADER))
                        .param("ocr", OCR_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.taskId").value("abc123"));

        verify(docGenService).generateAllAsync(eq("abc123"), any(byte[].class), any(OcrResult.class));
    }

    @Test
    void rejectsEmptyImage() throws Exception {
        mockMvc.perform(multipart("/api/doc-gen/process")
                        .file(new MockMultipartFile("image", "page.png", "image/png", new byte[0]))
                        .param("ocr", OCR_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void rejectsMalformedOcrJson() throws Exception {
        mockMvc.perform(multipart("/api/doc-gen/process")
                        .file(new MockMultipartFile("image", "page.png", "image/png", PNG_HEADER))
                        .param("ocr", "{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void rejectsUnknownImageFormat() throws Exception {
        mockMvc.perform(multipart("/api/doc-gen/process")
                        .file(new MockMultipartFile("image", "page.gif", "image/gif", new byte[]{'G', 'I', 'F', '8', '9'}))
                        .param("ocr", OCR_JSON))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.kind").value("UNSUPPORTED_IMAGE_FORMAT"));

        verify(docGenService, never()).createTask(any(byte[].class), any(OcrResult.class));
    }

    @Test
    void reportsMissingRawTextForMarkdown() throws Exception {
        when(docGenService.assembleMarkdown(any(OcrResult.class))).thenThrow(new MissingRawTextException());

        mockMvc.perform(post("/api/doc-gen/markdown")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"boxes\":[]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("MISSING_RAW_TEXT"));
    }

    @Test
    void returnsMarkdown() throws Exception {
        when(docGenService.assembleMarkdown(any(OcrResult.class))).thenReturn("# Title");

        mockMvc.perform(post("/api/doc-gen/markdown")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(OCR_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.markdown").value("# Title"));
    }

    @Test
    void cancelOfFinishedTaskIsConflict() throws Exception {
        when(docGenService.cancel("done")).thenReturn(false);
        when(docGenService.cancel("running")).thenReturn(true);

        mockMvc.perform(post("/api/doc-gen/cancel/done")).andExpect(status().isConflict());
        mockMvc.perform(post("/api/doc-gen/cancel/running")).andExpect(status().isOk());
    }

    @Test
    void zipsGeneratedArtifacts() throws Exception {
        File taskDir = tempDir.resolve("t1").toFile();
        assertTrue(taskDir.mkdirs());
        Files.write(new File(taskDir, "t1.md").toPath(), "# md".getBytes());
        Files.write(new File(taskDir, "t1.pdf").toPath(), new byte[]{1, 2});
        when(docGenService.getTaskDir("t1")).thenReturn(taskDir);

        MvcResult result = mockMvc.perform(get("/api/doc-gen/artifact/t1"))
                .andExpect(status().isOk())
                .andReturn();

        assertEquals(List.of("t1.md", "t1.pdf"), zipEntries(result.getResponse().getContentAsByteArray()));
    }

    @Test
    void artifactOfUnknownTaskIsNotFound() throws Exception {
        when(docGenService.getTaskDir("missing")).thenReturn(tempDir.resolve("missing").toFile());

        mockMvc.perform(get("/api/doc-gen/artifact/missing")).andExpect(status().isNotFound());
    }

    private static List<String> zipEntries(byte[] zip) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
