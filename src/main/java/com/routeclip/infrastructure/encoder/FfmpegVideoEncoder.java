package com.routeclip.infrastructure.encoder;

import com.routeclip.config.MediaProperties;
import com.routeclip.service.port.VideoEncoder;
import com.routeclip.service.port.VideoEncodingRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-encodes to H.264 with a constant rate factor. Runs on the calling thread until ffmpeg exits;
 * no timeout is applied.
 */
@Slf4j
@Component
public class FfmpegVideoEncoder implements VideoEncoder {

    public static final String MODE = "FFMPEG";

    private final String ffmpegCmd;
    private final int outputLimit;

    public FfmpegVideoEncoder(@Value("${app.ffmpeg.cmd:ffmpeg}") String ffmpegCmd,
                              MediaProperties properties) {
        this.ffmpegCmd = ffmpegCmd;
        this.outputLimit = properties.getProcessOutputLimit();
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public String encode(VideoEncodingRequest request) throws Exception {
        List<String> cmd = buildCommand(request);
        log.info("Transcoding video {}: {}", request.videoId(), String.join(" ", cmd));

        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.redirectErrorStream(true);

        Process p = pb.start();
        String logStr = readProcessOutputLimited(p.getInputStream(), outputLimit);
        int code = p.waitFor();

        if (code != 0) {
            throw new IOException("ffmpeg exited with code " + code + ": " + tail(logStr, 2000));
        }
        return logStr;
    }

    List<String> buildCommand(VideoEncodingRequest request) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegCmd);
        cmd.add("-y");
        cmd.add("-i"); cmd.add(request.input().toString());
        cmd.add("-c:v"); cmd.add("libx264");
        cmd.add("-crf"); cmd.add(String.valueOf(request.crf()));
        cmd.add(request.output().toString());
        return cmd;
    }

    private String readProcessOutputLimited(InputStream in, int maxBytes) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.min(maxBytes, 8192));
        byte[] chunk = new byte[4096];
        int total = 0;
        int n;
        // keep draining past the limit so ffmpeg never blocks on a full pipe
        while ((n = in.read(chunk)) != -1) {
            if (total < maxBytes) {
                int toWrite = Math.min(n, maxBytes - total);
                buffer.write(chunk, 0, toWrite);
                total += toWrite;
            }
        }
        return buffer.toString();
    }

    private static String tail(String s, int max) {
        return s.length() <= max ? s : s.substring(s.length() - max);
    }
}
