package com.docfederation.model.sync;

public record SubmitResult(SubmitStatus status, long sequence) {
}
