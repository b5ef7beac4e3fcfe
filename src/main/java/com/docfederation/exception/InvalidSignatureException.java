package com.docfederation.exception;

public class InvalidSignatureException extends DocSyncException {

    public InvalidSignatureException(String message) {
        super(ErrorCode.INVALID_SIGNATURE, message);
    }
}
