package com.work.faucet.app.web;

import com.work.faucet.app.web.dto.DisbursementRequest;
import com.work.faucet.app.web.dto.DisbursementResponse;
import com.work.faucet.core.DisbursementEngine;
import com.work.faucet.core.exception.FaucetException;
import com.work.faucet.core.model.Disbursement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * 唯一的对外接口：POST /request {"address": "0x..."}。
 * 所有单次请求错误都在这里转换为 {success=false, message}，不会影响进程。
 */
@RestController
public class FaucetController {

    private static final Logger log = LoggerFactory.getLogger(FaucetController.class);

    private final DisbursementEngine engine;

    public FaucetController(DisbursementEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/request")
    public ResponseEntity<DisbursementResponse> request(@Validated @RequestBody DisbursementRequest req) {
        Disbursement d = engine.requestDisbursement(req.getAddress());
        return ResponseEntity.ok(DisbursementResponse.success(d.getTxHash()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class,
            HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<DisbursementResponse> handleMalformed(Exception e) {
        log.debug("malformed faucet request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(DisbursementResponse.fail("Invalid request format"));
    }

    @ExceptionHandler(FaucetException.class)
    public ResponseEntity<DisbursementResponse> handleFaucet(FaucetException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.warn("faucet request failed. code={} message={}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.info("faucet request rejected. code={} message={}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(DisbursementResponse.fail(e.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<DisbursementResponse> handleUnexpected(RuntimeException e) {
        log.error("faucet request failed unexpectedly", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(DisbursementResponse.fail("internal error: " + e.getMessage()));
    }

    static HttpStatus statusOf(FaucetException e) {
        switch (e.getErrorCode()) {
            case INVALID_ADDRESS:
                return HttpStatus.BAD_REQUEST;
            case COOLDOWN_ACTIVE:
                return HttpStatus.TOO_MANY_REQUESTS;
            case PIPELINE_BUSY:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case NONCE_FETCH_FAILED:
            case GAS_PRICE_FETCH_FAILED:
            case GAS_ESTIMATE_FAILED:
            case BALANCE_QUERY_FAILED:
            case SUBMISSION_FAILED:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
