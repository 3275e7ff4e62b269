package com.example.scan2doc.controller;

import com.example.scan2doc.exception.DocGenException;
import com.example.scan2doc.exception.UnsupportedImageFormatException;
import com.example.scan2doc.service.DocGenService;
import com.example.scan2doc.util.ocr.dto.OcrResult;
import com.example.scan2doc.util.pdf.SandwichPdfBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * 扫描页 → Markdown / DOCX / 双层 PDF 控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/doc-gen")
public class DocGenController {

    @Autowired
    private DocGenService docGenService;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * 上传整页图像与 OCR 结果，后台生成文档
     *
     * 立即返回 taskId，使用 /status/{taskId} 轮询进度，完成后使用 /artifact/{taskId} 下载。
     *
     * @param image 整页图像（JPG / PNG）
     * @param ocr OCR 结果 JSON
     * @return 包含 taskId 的 JSON 响应
     */
    @PostMapping("/process")
    public ResponseEntity<Map<String, Object>> process(@RequestParam("image") MultipartFile image,
                                                       @RequestParam("ocr") String ocr) {
        Map<String, Object> result = new HashMap<>();

        if (image.isEmpty()) {
            result.put("success", false);
            result.put("message", "图像不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        OcrResult ocrResult;
        try {
            ocrResult = objectMapper.readValue(ocr, OcrResult.class);
        } catch (JsonProcessingException e) {
            log.warn("OCR 结果解析失败: {}", e.getOriginalMessage());
            result.put("success", false);
            result.put("message", "OCR 结果不是合法的 JSON");
            return ResponseEntity.badRequest().body(result);
        }

        try {
            byte[] bytes = image.getBytes();
            if (bytes.length < 4 || !(SandwichPdfBuilder.isJpeg(bytes) || SandwichPdfBuilder.isPng(bytes))) {
                return errorResponse(new UnsupportedImageFormatException(null));
            }

            log.info("接收图像: {}, {} 字节, prompt_type={}", image.getOriginalFilename(), bytes.length,
                    ocrResult.getPromptType());
            Map<String, Object> task = docGenService.createTask(bytes, ocrResult);
            String taskId = (String) task.get("taskId");

            docGenService.generateAllAsync(taskId, bytes, ocrResult);

            result.put("success", true);
            result.put("taskId", taskId);
            result.put("message", "已接收，正在后台生成。请使用 /status/{taskId} 查询进度，完成后使用 /artifact/{taskId} 下载结果");
            return ResponseEntity.ok(result);

        } catch (IOException e) {
            log.error("任务创建失败: {}", e.getMessage(), e);
            return errorResponse(new DocGenException(DocGenException.ErrorKind.IO_FAILURE, e.getMessage(), e));
        }
    }

    /**
     * 查询任务状态
     */
    @GetMapping("/status/{taskId}")
    public ResponseEntity<Map<String, Object>> getTaskStatus(@PathVariable String taskId) {
        log.info("查询任务状态: taskId={}", taskId);
        return ResponseEntity.ok(docGenService.getTaskStatus(taskId));
    }

    /**
     * 取消任务（排队中或生成中）
     */
    @PostMapping("/cancel/{taskId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String taskId) {
        Map<String, Object> result = new HashMap<>();
        boolean cancelled = docGenService.cancel(taskId);
        result.put("success", cancelled);
        result.put("taskId", taskId);
        result.put("message", cancelled ? "已请求取消" : "任务不存在或已结束");
        return cancelled ? ResponseEntity.ok(result) : ResponseEntity.status(HttpStatus.CONFLICT).body(result);
    }

    /**
     * 下载生成结果（ZIP：md、docx、pdf）
     */
    @GetMapping("/artifact/{taskId}")
    public ResponseEntity<byte[]> downloadArtifact(@PathVariable String taskId) {
        File taskDir = docGenService.getTaskDir(taskId);
        if (taskDir == null || !taskDir.isDirectory()) {
            log.warn("任务目录不存在: {}", taskId);
            return ResponseEntity.notFound().build();
        }

        try {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            int count = 0;
            try (ZipOutputStream zos = new ZipOutputStream(baos)) {
                for (String ext : new String[]{".md", ".docx", ".pdf"}) {
                    if (addFileToZip(zos, new File(taskDir, taskId + ext), taskId + ext)) {
                        count++;
                    }
                }
            }
            if (count == 0) {
                log.warn("任务尚未生成任何文件: {}", taskId);
                return ResponseEntity.notFound().build();
            }

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
            headers.setContentDispositionFormData("attachment", taskId + ".zip");
            log.info("下载artifact: taskId={}, 文件数={}", taskId, count);
            return new ResponseEntity<>(baos.toByteArray(), headers, HttpStatus.OK);

        } catch (IOException e) {
            log.error("下载artifact失败: taskId={}, error={}", taskId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * OCR 结果 → Markdown（同步，不切图）
     */
    @PostMapping("/markdown")
    public ResponseEntity<Map<String, Object>> markdown(@RequestBody OcrResult ocrResult) {
        try {
            String markdown = docGenService.assembleMarkdown(ocrResult);
            Map<String, Object> result = new HashMap<>();
            result.put("success", true);
            result.put("markdown", markdown);
            return ResponseEntity.ok(result);
        } catch (DocGenException e) {
            return errorResponse(e);
        }
    }

    /**
     * 错误类型 → HTTP 状态与提示语（不返回异常原文）
     */
    static ResponseEntity<Map<String, Object>> errorResponse(DocGenException e) {
        HttpStatus status;
        String message;
        switch (e.getKind()) {
            case MISSING_RAW_TEXT:
                status = HttpStatus.UNPROCESSABLE_ENTITY;
                message = "OCR 结果缺少原始文本，无法生成文档";
                break;
            case UNSUPPORTED_IMAGE_FORMAT:
                status = HttpStatus.UNSUPPORTED_MEDIA_TYPE;
                message = "仅支持 JPG 和 PNG 图像";
                break;
            case CANCELLED:
                status = HttpStatus.CONFLICT;
                message = "任务已取消";
                break;
            case IO_FAILURE:
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
                message = "文档读写失败，请稍后重试";
                break;
        }
        Map<String, Object> result = new HashMap<>();
        result.put("success", false);
        result.put("kind", e.getKind().name());
        result.put("message", message);
        return ResponseEntity.status(status).body(result);
    }

    /**
     * 将文件添加到ZIP压缩包，文件不存在时跳过
     */
    private boolean addFileToZip(ZipOutputStream zos, File file, String entryName) throws IOException {
        if (!file.exists()) {
            return false;
        }
        zos.putNextEntry(new ZipEntry(entryName));
        try (FileInputStream fis = new FileInputStream(file)) {
            byte[] buffer = new byte[8192];
            int len;
            while ((len = fis.read(buffer)) > 0) {
                zos.write(buffer, 0, len);
            }
        }
        zos.closeEntry();
        return true;
    }
}
