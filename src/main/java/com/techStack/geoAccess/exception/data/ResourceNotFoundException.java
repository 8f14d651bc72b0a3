package com.techStack.geoAccess.exception.data;

import com.techStack.geoAccess.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends CustomException {

    public ResourceNotFoundException(String resource, String id) {
        super(HttpStatus.NOT_FOUND, resource + " not found: " + id, "NOT_FOUND");
    }
}
