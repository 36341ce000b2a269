package com.routeclip.service.command;

import java.nio.file.Path;

public record CompressionTask(
    Long userId,
    Long videoId,
    Path rawPath,
    Path outputPath
) {}
