package com.example.scan2doc.service;

import com.example.scan2doc.exception.DocGenException;
import com.example.scan2doc.exception.GenerationCancelledException;
import com.example.scan2doc.exception.MissingRawTextException;
import com.example.scan2doc.exception.UnsupportedImageFormatException;
import com.example.scan2doc.util.common.CancellationSignal;
import com.example.scan2doc.util.docx.DocxGenerator;
import com.example.scan2doc.util.image.ExtractedImageStore;
import com.example.scan2doc.util.image.FileExtractedImageStore;
import com.example.scan2doc.util.image.PageImageSlicer;
import com.example.scan2doc.util.layout.LayoutConfig;
import com.example.scan2doc.util.markdown.MarkdownAssembler;
import com.example.scan2doc.util.ocr.dto.OcrResult;
import com.example.scan2doc.util.pdf.FontLoader;
import com.example.scan2doc.util.pdf.SandwichPdfBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 文档生成服务
 *
 * 一个任务对应一页扫描图像，任务目录结构：
 * <pre>
 * {basePath}/{taskId}/
 *   ├── {taskId}_page.jpg|png   上传的整页图像
 *   ├── {taskId}_ocr.json       OCR 结果
 *   ├── images/                 切图
 *   ├── {taskId}.md
 *   ├── {taskId}.docx
 *   ├── {taskId}.pdf
 *   └── status.json
 * </pre>
 *
 * 生成顺序：切图 → Markdown → DOCX → PDF，每个阶段开始前检查取消标记。
 */
@Slf4j
@Service
public class DocGenService {

    /**
     * 任务状态常量
     */
    public static final String STATUS_UPLOADED = "UPLOADED";       // 已上传
    public static final String STATUS_SLICING = "SLICING";         // 正在切图
    public static final String STATUS_MARKDOWN = "MARKDOWN";       // 正在生成 Markdown
    public static final String STATUS_DOCX = "DOCX";               // 正在生成 DOCX
    public static final String STATUS_PDF = "PDF";                 // 正在生成 PDF
    public static final String STATUS_COMPLETED = "COMPLETED";     // 处理完成
    public static final String STATUS_FAILED = "FAILED";           // 处理失败
    public static final String STATUS_CANCELLED = "CANCELLED";     // 已取消
    public static final String STATUS_NOT_FOUND = "NOT_FOUND";     // 任务不存在

    private static final String STATUS_FILE_NAME = "status.json";
    private static final String IMAGES_DIR = "images";
    private static final String TASK_ID_PATTERN = "[a-zA-Z0-9_-]+";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final String basePath;
    private final LayoutConfig layoutConfig;
    private final FontLoader fontLoader;
    private final String fontUrl;

    /**
     * 运行中（含排队中）任务的取消标记
     */
    private final Map<String, CancellationSignal> signals = new ConcurrentHashMap<>();

    @Autowired
    public DocGenService(@Value("${scan2doc.storage.base-path:/data/scan2doc}") String basePath,
                         LayoutConfig layoutConfig,
                         FontLoader fontLoader,
                         @Value("${scan2doc.font.cjk-url:}") String fontUrl) {
        this.basePath = basePath;
        this.layoutConfig = layoutConfig;
        this.fontLoader = fontLoader;
        this.fontUrl = fontUrl;
    }

    /**
     * 保存上传的图像与 OCR 结果，创建任务
     *
     * @param image 整页图像（已校验为 JPEG / PNG）
     * @param ocrResult OCR 结果
     * @return 包含 taskId、taskDir 的 Map
     * @throws IOException 文件保存异常
     */
    public Map<String, Object> createTask(byte[] image, OcrResult ocrResult) throws IOException {
        String taskId = UUID.randomUUID().toString().replace("-", "");

        File taskDir = new File(basePath, taskId);
        if (!taskDir.exists()) {
            boolean created = taskDir.mkdirs();
            log.info("创建任务目录: {}, 结果: {}", taskDir.getAbsolutePath(), created);
        }

        String ext = SandwichPdfBuilder.isJpeg(image) ? "jpg" : "png";
        Files.write(new File(taskDir, taskId + "_page." + ext).toPath(), image);
        Files.write(new File(taskDir, taskId + "_ocr.json").toPath(), JSON_MAPPER.writeValueAsBytes(ocrResult));

        signals.put(taskId, new CancellationSignal());
        updateTaskStatus(taskId, STATUS_UPLOADED, "文件已上传，等待生成", null);
        log.info("[taskId: {}] 任务已创建", taskId);

        Map<String, Object> result = new HashMap<>();
        result.put("taskId", taskId);
        result.put("taskDir", taskDir.getAbsolutePath());
        return result;
    }

    /**
     * 只有 document 模式的 OCR 结果才生成文档
     */
    public static boolean shouldGenerate(OcrResult ocrResult) {
        return ocrResult != null && OcrResult.PROMPT_TYPE_DOCUMENT.equals(ocrResult.getPromptType());
    }

    /**
     * 异步生成（结果写入 status.json）
     */
    @Async
    public void generateAllAsync(String taskId, byte[] image, OcrResult ocrResult) {
        log.info("[taskId: {}] 开始异步生成...", taskId);
        CancellationSignal signal = signals.computeIfAbsent(taskId, k -> new CancellationSignal());
        try {
            generateAll(taskId, image, ocrResult, signal);
        } catch (GenerationCancelledException e) {
            log.info("[taskId: {}] 任务已取消: {}", taskId, e.getMessage());
            updateTaskStatus(taskId, STATUS_CANCELLED, "任务已取消", null);
        } catch (DocGenException e) {
            log.error("[taskId: {}] 生成失败: kind={}, {}", taskId, e.getKind(), e.getMessage(), e);
            Map<String, Object> errorInfo = new HashMap<>();
            errorInfo.put("kind", e.getKind().name());
            updateTaskStatus(taskId, STATUS_FAILED, "生成失败", errorInfo);
        } catch (RuntimeException e) {
            log.error("[taskId: {}] 生成失败: {}", taskId, e.getMessage(), e);
            updateTaskStatus(taskId, STATUS_FAILED, "生成失败", null);
        } finally {
            signals.remove(taskId);
        }
    }

    /**
     * 生成 Markdown、DOCX、双层 PDF
     *
     * @param taskId 任务ID（同时作为切图ID前缀）
     * @param image 整页图像
     * @param ocrResult OCR 结果
     * @param signal 取消标记
     * @return 生成结果信息（文件名、切图数量等）
     * @throws GenerationCancelledException 阶段开始前发现已取消
     * @throws DocGenException raw_text 缺失、图像格式不支持、读写失败
     */
    public Map<String, Object> generateAll(String taskId, byte[] image, OcrResult ocrResult, CancellationSignal signal)
            throws DocGenException {
        Map<String, Object> info = new HashMap<>();
        if (!shouldGenerate(ocrResult)) {
            log.info("[taskId: {}] 非文档模式 (prompt_type={})，跳过生成", taskId,
                    ocrResult != null ? ocrResult.getPromptType() : null);
            info.put("generated", false);
            updateTaskStatus(taskId, STATUS_COMPLETED, "非文档模式，未生成文档", info);
            return info;
        }
        if (ocrResult.getRawText() == null || ocrResult.getRawText().isEmpty()) {
            throw new MissingRawTextException();
        }
        if (image == null || image.length < 4 || !(SandwichPdfBuilder.isJpeg(image) || SandwichPdfBuilder.isPng(image))) {
            throw new UnsupportedImageFormatException(null);
        }

        File taskDir = new File(basePath, taskId);
        ExtractedImageStore imageStore = new FileExtractedImageStore(new File(taskDir, IMAGES_DIR));

        try {
            // Step 1: 切图
            signal.checkpoint(STATUS_SLICING);
            log.info("[taskId: {}] Step 1: 切图...", taskId);
            updateTaskStatus(taskId, STATUS_SLICING, "正在切图", null);
            Map<Integer, String> imageMap = new PageImageSlicer(imageStore).sliceImages(taskId, image, ocrResult.getBoxes());
            info.put("imageCount", imageMap.size());

            // Step 2: Markdown
            signal.checkpoint(STATUS_MARKDOWN);
            log.info("[taskId: {}] Step 2: 生成 Markdown...", taskId);
            updateTaskStatus(taskId, STATUS_MARKDOWN, "正在生成 Markdown", null);
            String markdown = new MarkdownAssembler(layoutConfig).assemble(ocrResult, imageMap);
            File mdFile = new File(taskDir, taskId + ".md");
            Files.write(mdFile.toPath(), markdown.getBytes(StandardCharsets.UTF_8));
            info.put("markdown", mdFile.getName());

            // Step 3: DOCX
            signal.checkpoint(STATUS_DOCX);
            log.info("[taskId: {}] Step 3: 生成 DOCX...", taskId);
            updateTaskStatus(taskId, STATUS_DOCX, "正在生成 DOCX", null);
            byte[] docx = new DocxGenerator(imageStore).generate(markdown);
            File docxFile = new File(taskDir, taskId + ".docx");
            Files.write(docxFile.toPath(), docx);
            info.put("docx", docxFile.getName());

            // Step 4: 双层 PDF
            signal.checkpoint(STATUS_PDF);
            log.info("[taskId: {}] Step 4: 生成双层 PDF...", taskId);
            updateTaskStatus(taskId, STATUS_PDF, "正在生成 PDF", null);
            byte[] pdf = new SandwichPdfBuilder(fontLoader, fontUrl, layoutConfig).build(image, ocrResult);
            File pdfFile = new File(taskDir, taskId + ".pdf");
            Files.write(pdfFile.toPath(), pdf);
            info.put("pdf", pdfFile.getName());

            signal.checkpoint(STATUS_COMPLETED);
        } catch (IOException e) {
            throw new DocGenException(DocGenException.ErrorKind.IO_FAILURE, "Failed to write task files: " + taskId, e);
        }

        info.put("generated", true);
        log.info("[taskId: {}] 生成完成！", taskId);
        updateTaskStatus(taskId, STATUS_COMPLETED, "处理完成", info);
        return info;
    }

    /**
     * 取消任务
     *
     * @return 任务仍在排队或运行中时返回 true
     */
    public boolean cancel(String taskId) {
        CancellationSignal signal = signals.get(taskId);
        if (signal == null) {
            return false;
        }
        signal.cancel();
        log.info("[taskId: {}] 已请求取消", taskId);
        return true;
    }

    /**
     * 同步生成 Markdown（不切图）
     */
    public String assembleMarkdown(OcrResult ocrResult) throws MissingRawTextException {
        return new MarkdownAssembler(layoutConfig).assemble(ocrResult, null);
    }

    /**
     * 根据 taskId 获取任务目录；taskId 含非法字符时返回 null
     */
    public File getTaskDir(String taskId) {
        if (taskId == null || !taskId.matches(TASK_ID_PATTERN)) {
            return null;
        }
        return new File(basePath, taskId);
    }

    /**
     * 更新任务状态（写入 status.json）
     *
     * @param taskId 任务ID
     * @param status 状态
     * @param message 状态消息
     * @param extra 额外信息（可选）
     */
    public void updateTaskStatus(String taskId, String status, String message, Map<String, Object> extra) {
        File taskDir = new File(basePath, taskId);
        File statusFile = new File(taskDir, STATUS_FILE_NAME);

        Map<String, Object> statusData = new HashMap<>();
        statusData.put("taskId", taskId);
        statusData.put("status", status);
        statusData.put("message", message);
        statusData.put("updateTime", System.currentTimeMillis());
        if (extra != null) {
            statusData.putAll(extra);
        }

        try {
            String json = new GsonBuilder()
                    .setPrettyPrinting()
                    .create()
                    .toJson(statusData);
            Files.write(statusFile.toPath(), json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("[taskId: {}] 写入状态文件失败: {}", taskId, e.getMessage());
        }
    }

    /**
     * 查询任务状态（读取 status.json）
     *
     * @param taskId 任务ID
     * @return 任务状态信息
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getTaskStatus(String taskId) {
        Map<String, Object> result = new HashMap<>();
        result.put("taskId", taskId);

        File taskDir = getTaskDir(taskId);
        if (taskDir == null || !taskDir.isDirectory()) {
            result.put("exists", false);
            result.put("status", STATUS_NOT_FOUND);
            result.put("message", "任务不存在");
            return result;
        }
        result.put("exists", true);

        File statusFile = new File(taskDir, STATUS_FILE_NAME);
        if (statusFile.exists()) {
            try {
                String json = new String(Files.readAllBytes(statusFile.toPath()), StandardCharsets.UTF_8);
                Map<String, Object> statusData = new Gson().fromJson(json, Map.class);
                result.putAll(statusData);
            } catch (IOException e) {
                log.error("[taskId: {}] 读取状态文件失败: {}", taskId, e.getMessage());
                result.put("status", "UNKNOWN");
                result.put("message", "无法读取状态文件");
            }
        } else {
            result.put("status", "UNKNOWN");
            result.put("message", "状态未知");
        }
        return result;
    }
}
