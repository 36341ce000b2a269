package com.routeclip.service.port;

import java.nio.file.Path;

public record VideoEncodingRequest(
    Long videoId,
    Path input,
    Path output,
    int crf
) {}
