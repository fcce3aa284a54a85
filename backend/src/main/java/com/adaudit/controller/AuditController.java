package com.adaudit.controller;

import com.adaudit.exception.InvalidInputException;
import com.adaudit.model.DocumentReport;
import com.adaudit.model.KeywordRule.Tier;
import com.adaudit.model.ProductProfile;
import com.adaudit.model.Segment;
import com.adaudit.model.ValidationResult;
import com.adaudit.rule.RuleTables;
import com.adaudit.service.ComplianceCheckService;
import com.adaudit.util.UploadTextDecoder;
import com.adaudit.util.UploadTextDecoder.DecodedUpload;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 广告文审查 API 控制器
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class AuditController {

    private static final Logger log = LoggerFactory.getLogger(AuditController.class);

    private final ComplianceCheckService checkService;
    private final RuleTables ruleTables;

    public AuditController(ComplianceCheckService checkService, RuleTables ruleTables) {
        this.checkService = checkService;
        this.ruleTables = ruleTables;
    }

    public record TextRequest(@NotBlank(message = "请提供广告文 (text)") String text, String productId) {
    }

    public record SegmentCheckRequest(
            @NotBlank(message = "请提供片段文本 (segmentText)") String segmentText,
            String fullText,
            String productId) {
    }

    /**
     * 分段
     */
    @PostMapping("/segment")
    public ResponseEntity<?> segment(@Valid @RequestBody TextRequest request) {
        try {
            List<Segment> segments = checkService.segment(request.text(), request.productId());
            return ResponseEntity.ok(Map.of("totalSegments", segments.size(), "segments", segments));
        } catch (InvalidInputException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("分段失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "分段过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 检查整篇广告文
     */
    @PostMapping("/check")
    public ResponseEntity<?> check(@Valid @RequestBody TextRequest request) {
        try {
            log.info("收到广告文检查请求: {} 字, 商品 {}", request.text().length(), request.productId());
            DocumentReport report = checkService.checkDocument(request.text(), request.productId());
            return ResponseEntity.ok(report);
        } catch (InvalidInputException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("广告文检查失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "检查过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 检查单个片段
     */
    @PostMapping("/check/segment")
    public ResponseEntity<?> checkSegment(@Valid @RequestBody SegmentCheckRequest request) {
        try {
            ValidationResult result = checkService.checkSegment(
                    request.segmentText(), request.fullText(), request.productId());
            return ResponseEntity.ok(result);
        } catch (InvalidInputException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("片段检查失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "检查过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 上传 .txt 广告文进行检查
     */
    @PostMapping("/check/file")
    public ResponseEntity<?> checkFile(@RequestParam("file") MultipartFile file,
                                       @RequestParam(value = "productId", required = false) String productId) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传文件"));
        }

        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".txt")) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传 .txt 格式的广告文"));
        }

        try {
            byte[] bytes = file.getBytes();
            DecodedUpload decoded = UploadTextDecoder.decode(bytes, filename);
            log.info("收到广告文文件检查请求: {}, 大小: {} bytes, 编码: {}", filename, bytes.length, decoded.charset().name());

            DocumentReport report = checkService.checkDocument(decoded.text(), productId);
            if (decoded.notice() != null) {
                report.getNotices().add(decoded.notice());
            }
            return ResponseEntity.ok(report);
        } catch (InvalidInputException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("广告文文件检查失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "检查过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 各层级规则数与已加载的商品配置
     */
    @GetMapping("/rules")
    public ResponseEntity<?> getRuleOverview() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Tier tier : Tier.values()) {
            counts.put(tier.code(), ruleTables.count(tier));
        }
        List<ProductProfile> products = ruleTables.productIds().stream()
                .map(ruleTables::product)
                .flatMap(Optional::stream)
                .toList();
        return ResponseEntity.ok(Map.of("counts", counts, "products", products));
    }

    /**
     * 某一层级的全部规则
     */
    @GetMapping("/rules/{tier}")
    public ResponseEntity<?> getRules(@PathVariable String tier) {
        for (Tier t : Tier.values()) {
            if (t.code().equalsIgnoreCase(tier)) {
                return ResponseEntity.ok(ruleTables.rulesFor(t, null));
            }
        }
        return ResponseEntity.badRequest()
                .body(Map.of("error", "未知的规则层级: " + tier + "（absolute / conditional / context-dependent）"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
