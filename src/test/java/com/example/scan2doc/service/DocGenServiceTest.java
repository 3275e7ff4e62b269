package com.example.scan2doc.service;

import com.example.scan2doc.exception.DocGenException;
import com.example.scan2doc.exception.GenerationCancelledException;
import com.example.scan2doc.exception.MissingRawTextException;
import com.example.scan2doc.util.common.CancellationSignal;
import com.example.scan2doc.util.layout.LayoutConfig;
import com.example.scan2doc.util.ocr.dto.ImageDims;
import com.example.scan2doc.util.ocr.dto.OcrBox;
import com.example.scan2doc.util.ocr.dto.OcrResult;
import com.example.scan2doc.util.pdf.FontLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocGenServiceTest {

    private static final String RAW_TEXT =
            "<|ref|>title<|/ref|><|det|>[[20,10,380,40]]<|/det|># Report\n"
                    + "<|ref|>text<|/ref|><|det|>[[20,60,180,200]]<|/det|>Left column text\n"
                    + "<|ref|>image<|/ref|><|det|>[[220,60,380,200]]<|/det|>";

    @TempDir
    Path tempDir;

    private DocGenService service;
    private byte[] png;

    @BeforeEach
    void setUp() throws IOException {
        service = new DocGenService(tempDir.toString(), LayoutConfig.loadDefault(), new FontLoader(1, 0), "");
        BufferedImage image = new BufferedImage(400, 300, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        png = out.toByteArray();
    }

    private static OcrResult documentOcr() {
        return new OcrResult(RAW_TEXT,
                Arrays.asList(new OcrBox("title", new double[]{20, 10, 380, 40}),
                        new OcrBox("image", new double[]{220, 60, 380, 200})),
                new ImageDims(400, 300));
    }

    @Test
    void createTaskStoresInputsAndStatus() throws Exception {
        Map<String, Object> task = service.createTask(png, documentOcr());
        String taskId = (String) task.get("taskId");

        File taskDir = new File(tempDir.toFile(), taskId);
        assertTrue(new File(taskDir, taskId + "_page.png").isFile());
        assertTrue(new File(taskDir, taskId + "_ocr.json").isFile());
        String ocrJson = new String(Files.readAllBytes(new File(taskDir, taskId + "_ocr.json").toPath()),
                StandardCharsets.UTF_8);
        assertTrue(ocrJson.contains("\"raw_text\""));

        Map<String, Object> status = service.getTaskStatus(taskId);
        assertEquals(true, status.get("exists"));
        assertEquals(DocGenService.STATUS_UPLOADED, status.get("status"));
    }

    @Test
    void generatesAllArtifacts() throws Exception {
        String taskId = (String) service.createTask(png, documentOcr()).get("taskId");

        Map<String, Object> info = service.generateAll(taskId, png, documentOcr(), new CancellationSignal());

        File taskDir = new File(tempDir.toFile(), taskId);
        assertEquals(true, info.get("generated"));
        assertEquals(1, info.get("imageCount"));
        assertTrue(new File(taskDir, taskId + ".docx").length() > 0);
        assertTrue(new File(taskDir, taskId + ".pdf").length() > 0);
        assertEquals(1, new File(taskDir, "images").listFiles().length);

        String markdown = new String(Files.readAllBytes(new File(taskDir, taskId + ".md").toPath()),
                StandardCharsets.UTF_8);
        assertTrue(markdown.startsWith("# Report"));
        assertTrue(markdown.contains("Left column text"));
        assertTrue(markdown.contains("scan2doc-img:" + taskId + "_1_"));

        assertEquals(DocGenService.STATUS_COMPLETED, service.getTaskStatus(taskId).get("status"));
    }

    @Test
    void stopsBeforeFirstStageWhenCancelled() throws Exception {
        String taskId = (String) service.createTask(png, documentOcr()).get("taskId");
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThrows(GenerationCancelledException.class,
                () -> service.generateAll(taskId, png, documentOcr(), signal));
        assertFalse(new File(new File(tempDir.toFile(), taskId), taskId + ".md").exists());
    }

    @Test
    void cancelledAsyncRunIsRecordedInStatus() throws Exception {
        String taskId = (String) service.createTask(png, documentOcr()).get("taskId");

        assertTrue(service.cancel(taskId));
        service.generateAllAsync(taskId, png, documentOcr());

        assertEquals(DocGenService.STATUS_CANCELLED, service.getTaskStatus(taskId).get("status"));
        assertFalse(service.cancel(taskId));
    }

    @Test
    void failedAsyncRunRecordsErrorKind() throws Exception {
        OcrResult broken = new OcrResult(null, null, null);
        String taskId = (String) service.createTask(png, broken).get("taskId");

        service.generateAllAsync(taskId, png, broken);

        Map<String, Object> status = service.getTaskStatus(taskId);
        assertEquals(DocGenService.STATUS_FAILED, status.get("status"));
        assertEquals("MISSING_RAW_TEXT", status.get("kind"));
    }

    @Test
    void skipsNonDocumentResults() throws Exception {
        OcrResult ocr = documentOcr();
        ocr.setPromptType("free_ocr");
        String taskId = (String) service.createTask(png, ocr).get("taskId");

        Map<String, Object> info = service.generateAll(taskId, png, ocr, new CancellationSignal());

        assertEquals(false, info.get("generated"));
        assertFalse(new File(new File(tempDir.toFile(), taskId), taskId + ".md").exists());
        assertEquals(DocGenService.STATUS_COMPLETED, service.getTaskStatus(taskId).get("status"));
    }

    @Test
    void rejectsUnsupportedImage() throws Exception {
        String taskId = (String) service.createTask(png, documentOcr()).get("taskId");

        DocGenException e = assertThrows(DocGenException.class,
                () -> service.generateAll(taskId, new byte[]{0, 1, 2, 3, 4}, documentOcr(), new CancellationSignal()));
        assertEquals(DocGenException.ErrorKind.UNSUPPORTED_IMAGE_FORMAT, e.getKind());
    }

    @Test
    void assemblesMarkdownSynchronously() throws Exception {
        assertEquals("plain text", service.assembleMarkdown(new OcrResult("plain text", null, null)));
        assertThrows(MissingRawTextException.class, () -> service.assembleMarkdown(new OcrResult(null, null, null)));
    }

    @Test
    void unknownTasksAreReportedAsNotFound() {
        Map<String, Object> status = service.getTaskStatus("does-not-exist");

        assertEquals(false, status.get("exists"));
        assertEquals(DocGenService.STATUS_NOT_FOUND, status.get("status"));
        assertNull(service.getTaskDir("../etc"));
        assertFalse(service.cancel("does-not-exist"));
    }
}
