package com.routeclip.service.port;

/**
 * Transcodes one raw upload into its compressed output. Implementations are picked by
 * {@code app.media.transcode-mode}.
 */
public interface VideoEncoder {

    /**
     * Name matched against the configured transcode mode, case-insensitively.
     */
    String mode();

    /**
     * Writes {@code request.output()}; the input is left in place.
     *
     * @return captured tool output, possibly truncated
     * @throws Exception if the output could not be produced
     */
    String encode(VideoEncodingRequest request) throws Exception;

    default boolean supports(String configuredMode) {
        return configuredMode != null && mode().equalsIgnoreCase(configuredMode.trim());
    }
}
