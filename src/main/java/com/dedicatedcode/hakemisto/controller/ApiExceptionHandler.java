/*
 *  This file is part of hakemisto.
 *
 *  Hakemisto is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Hakemisto is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Hakemisto. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.hakemisto.controller;

import com.dedicatedcode.hakemisto.exception.FeatureIdParseException;
import com.dedicatedcode.hakemisto.exception.FeatureNotFoundException;
import com.dedicatedcode.hakemisto.exception.IndexNotBuiltException;
import com.dedicatedcode.hakemisto.exception.StorageException;
import com.dedicatedcode.hakemisto.exception.TooManyMatchesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Turns storage errors into JSON error responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({FeatureIdParseException.class, TooManyMatchesException.class})
    public ResponseEntity<Map<String, Object>> badRequest(StorageException e) {
        logger.debug("Rejected request for {}: {}", e.getInput(), e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(FeatureNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(FeatureNotFoundException e) {
        logger.debug("Not found: {}", e.getMessage());
        return body(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(IndexNotBuiltException.class)
    public ResponseEntity<Map<String, Object>> unavailable(IndexNotBuiltException e) {
        logger.warn("Request needs an index that is not available: {}", e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    // IndexReadException, MissingMetadataException and anything else from the storage layer
    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> storageFailure(StorageException e) {
        logger.error("Storage failure for {}: {}", e.getInput(), e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, StorageException e) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", e.getMessage());
        if (e.getInput() != null) {
            error.put("input", e.getInput());
        }
        return ResponseEntity.status(status).body(error);
    }
}
