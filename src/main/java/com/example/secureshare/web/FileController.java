package com.example.secureshare.web;

import com.example.secureshare.config.SecureShareProperties;
import com.example.secureshare.entity.SharedLinkEntity;
import com.example.secureshare.entity.UserEntity;
import com.example.secureshare.model.PagedResult;
import com.example.secureshare.model.ReceivedFileView;
import com.example.secureshare.model.SentFileView;
import com.example.secureshare.service.AccessControlEvaluator;
import com.example.secureshare.service.AccessDecision;
import com.example.secureshare.service.PageWindow;
import com.example.secureshare.service.PersistenceGateway;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.UUID;

@RestController
@RequestMapping("/api/files")
public class FileController {

    private static final Logger log = LoggerFactory.getLogger(FileController.class);

    private final PersistenceGateway gateway;
    private final AccessControlEvaluator accessControl;
    private final PasswordEncoder passwordEncoder;
    private final BlockingCalls blockingCalls;
    private final SecureShareProperties.Pagination pagination;

    public FileController(PersistenceGateway gateway,
                          AccessControlEvaluator accessControl,
                          PasswordEncoder passwordEncoder,
                          BlockingCalls blockingCalls,
                          SecureShareProperties properties) {
        this.gateway = gateway;
        this.accessControl = accessControl;
        this.passwordEncoder = passwordEncoder;
        this.blockingCalls = blockingCalls;
        this.pagination = properties.getPagination();
    }

    // POST /api/files/upload
    @PostMapping("/upload")
    public Mono<ResponseEntity<UploadResponse>> upload(@RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) UUID userId,
                                                       @Valid @RequestBody UploadFileRequest request) {
        return blockingCalls.call(() -> {
            UserEntity recipient = gateway.findUserByEmail(request.recipientEmail())
                    .orElseThrow(() -> HttpError.notFound("Recipient user not found"));
            if (recipient.getId().equals(userId)) {
                throw HttpError.badRequest("Cannot share a file with yourself");
            }
            if (!recipient.hasPublicKey()) {
                throw HttpError.badRequest("Recipient has not enrolled a public key");
            }

            SharedLinkEntity link = gateway.storeEncryptedFile(
                    userId,
                    request.fileName(),
                    request.fileSize(),
                    recipient.getId(),
                    passwordEncoder.encode(request.password()),
                    request.expirationDate(),
                    request.encryptedKey(),
                    request.encryptedPayload(),
                    request.iv());
            return link.getId();
        }).map(sharedId -> ResponseEntity.status(HttpStatus.CREATED)
                .body(new UploadResponse("success", "File uploaded and encrypted successfully", sharedId)));
    }

    // POST /api/files/retrieve
    @PostMapping("/retrieve")
    public Mono<RetrievedFileResponse> retrieve(@RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) UUID userId,
                                                @Valid @RequestBody RetrieveFileRequest request) {
        return blockingCalls.call(() -> accessControl.authorize(request.sharedId(), userId, request.password()))
                .map(decision -> switch (decision.getOutcome()) {
                    case GRANTED -> new RetrievedFileResponse("success", RetrievedFileDto.from(decision.getFile()));
                    case WRONG_PASSWORD -> throw HttpError.unauthorized("Incorrect password");
                    case NOT_FOUND -> throw HttpError.notFound("File not found or link expired");
                });
    }

    // GET /api/files/sent?page=1&limit=10
    @GetMapping("/sent")
    public Mono<FileListResponse<SentFileView>> sent(@RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) UUID userId,
                                                     @RequestParam(defaultValue = "1") int page,
                                                     @RequestParam(required = false) Integer limit) {
        PageWindow window = window(page, limit);
        return blockingCalls.call(() -> gateway.listSentFiles(userId, window.getPage(), window.getPageSize()))
                .map(FileController::toResponse);
    }

    // GET /api/files/received?page=1&limit=10
    @GetMapping("/received")
    public Mono<FileListResponse<ReceivedFileView>> received(@RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) UUID userId,
                                                             @RequestParam(defaultValue = "1") int page,
                                                             @RequestParam(required = false) Integer limit) {
        PageWindow window = window(page, limit);
        return blockingCalls.call(() -> gateway.listReceivedFiles(userId, window.getPage(), window.getPageSize()))
                .map(FileController::toResponse);
    }

    private PageWindow window(int page, Integer limit) {
        int pageSize = limit != null ? limit : pagination.getDefaultPageSize();
        PageWindow window = PageWindow.of(page, pageSize, pagination.getMaxPageSize());
        log.debug("Listing request: {}", window);
        return window;
    }

    private static <T> FileListResponse<T> toResponse(PagedResult<T> result) {
        return new FileListResponse<>("success", result.items(), result.totalCount());
    }
}
