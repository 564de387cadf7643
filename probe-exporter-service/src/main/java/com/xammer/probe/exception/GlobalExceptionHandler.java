package com.xammer.probe.exception;

import org.apache.catalina.connector.ClientAbortException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * The scraper gave up and disconnected; there is nobody left to answer.
     */
    @ExceptionHandler(ClientAbortException.class)
    public void handleClientAbortException() {
        logger.debug("Scraper disconnected before the response was written");
    }

    /**
     * Last resort for failures outside the probes. Answers in plain text so the
     * scraper reports a clear error instead of a parse failure.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> globalExceptionHandler(Exception ex) {
        if (ex instanceof ClientAbortException || ex.getCause() instanceof ClientAbortException) {
            return null;
        }
        logger.error("Scrape failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.TEXT_PLAIN)
                .body("An unexpected error occurred: " + ex.getMessage() + "\n");
    }
}
