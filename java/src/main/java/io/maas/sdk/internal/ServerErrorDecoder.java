package io.maas.sdk.internal;

import io.maas.sdk.BadRequestException;
import io.maas.sdk.CannotCompleteException;
import io.maas.sdk.MaasServerException;
import io.maas.sdk.PermissionDeniedException;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpHeaders;

/**
 * Utility for turning error responses from MAAS into typed exceptions.
 */
public final class ServerErrorDecoder {

    private ServerErrorDecoder() {
    }

    /**
     * Drains the error body and wraps it, untouched, in a {@link MaasServerException}. MAAS error bodies are plain
     * text, so no attempt is made to parse them.
     */
    public static MaasServerException decode(int statusCode, InputStream bodyStream, HttpHeaders headers) throws IOException {
        if (bodyStream == null) {
            return new MaasServerException(statusCode, new byte[0], headers);
        }
        return new MaasServerException(statusCode, bodyStream.readAllBytes(), headers);
    }

    /**
     * Specialises a server error for resource calls: 400 becomes {@link BadRequestException}, 401 and 403 become
     * {@link PermissionDeniedException}, 409 becomes {@link CannotCompleteException}. Everything else is returned
     * unchanged.
     */
    public static MaasServerException classify(MaasServerException error) {
        switch (error.getStatusCode()) {
            case 400:
                return new BadRequestException(error);
            case 401:
            case 403:
                return new PermissionDeniedException(error);
            case 409:
                return new CannotCompleteException(error);
            default:
                return error;
        }
    }
}
