package com.dev.watchsync.player;

import com.dev.watchsync.engine.LocalPlayer;
import com.dev.watchsync.engine.PlayerListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives an mpv instance started with {@code --input-ipc-server=<socket>}.
 * <p>
 * mpv is treated as a remote system: commands are written to its socket and never awaited, while observed
 * properties (time, pause, speed, path, cache stalls) are cached from the events it pushes back. Getters only read the cache,
 * which commands update optimistically so that a seek is visible before mpv confirms it.
 */
@Slf4j
public class MpvPlayer implements LocalPlayer, Closeable {

    private static final String TIME = "playback-time";
    private static final String PAUSE = "pause";
    private static final String SPEED = "speed";
    private static final String PATH = "path";
    private static final String CACHE_PAUSE = "paused-for-cache";

    private final ObjectMapper mapper;
    private final Path socketPath;

    private volatile SocketChannel socket;
    private volatile WritableByteChannel out;

    @Setter
    private volatile PlayerListener listener = PlayerListener.NOOP;

    private volatile double position;
    private volatile double speed = 1.0;
    private volatile boolean paused = true;
    private volatile String path;
    private volatile boolean seeking;
    private volatile boolean buffering;

    public MpvPlayer(ObjectMapper mapper, Path socketPath) {
        this.mapper = mapper;
        this.socketPath = socketPath;
    }

    MpvPlayer(ObjectMapper mapper, WritableByteChannel out) {
        this.mapper = mapper;
        this.socketPath = null;
        this.out = out;
    }

    public synchronized void connect() throws IOException {
        if (socket != null) {
            return;
        }
        SocketChannel channel = SocketChannel.open(UnixDomainSocketAddress.of(socketPath));
        this.socket = channel;
        this.out = channel;
        observe(1, TIME);
        observe(2, PAUSE);
        observe(3, SPEED);
        observe(4, PATH);
        observe(5, CACHE_PAUSE);

        Thread reader = new Thread(() -> readLoop(channel), "mpv-ipc-reader");
        reader.setDaemon(true);
        reader.start();
        log.info("Connected to mpv at {}", socketPath);
    }

    public boolean isConnected() {
        return out != null;
    }

    @Override
    public double currentTime() {
        return position;
    }

    @Override
    public void seek(double position) {
        this.position = position;
        command("set_property", TIME, position);
    }

    @Override
    public double playbackRate() {
        return speed;
    }

    @Override
    public void setPlaybackRate(double rate) {
        this.speed = rate;
        command("set_property", SPEED, rate);
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    @Override
    public void play() {
        this.paused = false;
        command("set_property", PAUSE, false);
    }

    @Override
    public void pause() {
        this.paused = true;
        command("set_property", PAUSE, true);
    }

    @Override
    public String contentRef() {
        return path;
    }

    @Override
    public void load(String contentRef) {
        this.path = contentRef;
        this.position = 0.0;
        if (contentRef == null) {
            command("stop");
        } else {
            command("loadfile", contentRef, "replace");
        }
    }

    @Override
    public synchronized void close() {
        SocketChannel channel = socket;
        socket = null;
        out = null;
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                log.debug("Closing mpv socket: {}", e.getMessage());
            }
        }
    }

    void handleMessage(String line) {
        JsonNode message;
        try {
            message = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable mpv message: {}", line);
            return;
        }
        String event = message.path("event").asText("");
        switch (event) {
            case "property-change" -> onPropertyChange(message.path("name").asText(""), message.path("data"));
            case "seek" -> seeking = true;
            case "playback-restart" -> {
                if (seeking) {
                    seeking = false;
                    listener.seeked(position);
                }
            }
            case "" -> {
                String error = message.path("error").asText("success");
                if (!"success".equals(error)) {
                    log.warn("mpv rejected request {}: {}", message.path("request_id").asText("?"), error);
                }
            }
            default -> log.trace("mpv event {}", event);
        }
    }

    private void onPropertyChange(String name, JsonNode data) {
        switch (name) {
            case TIME -> {
                if (data.isNumber()) {
                    position = data.asDouble();
                }
            }
            case PAUSE -> {
                if (!data.isBoolean() || data.asBoolean() == paused) {
                    return;
                }
                paused = data.asBoolean();
                if (paused) {
                    listener.paused(position);
                } else {
                    listener.played(position);
                }
            }
            case SPEED -> {
                if (data.isNumber()) {
                    speed = data.asDouble();
                }
            }
            case PATH -> {
                String next = data.isNull() || data.isMissingNode() ? null : data.asText();
                if (!Objects.equals(next, path)) {
                    path = next;
                    listener.sourceChanged(next);
                }
            }
            case CACHE_PAUSE -> {
                if (!data.isBoolean() || data.asBoolean() == buffering) {
                    return;
                }
                buffering = data.asBoolean();
                listener.bufferingChanged(buffering);
            }
            default -> log.trace("Ignoring mpv property {}", name);
        }
    }

    public boolean isBuffering() {
        return buffering;
    }

    private void observe(int id, String property) {
        command("observe_property", id, property);
    }

    private void command(Object... args) {
        WritableByteChannel channel = out;
        if (channel == null) {
            log.debug("mpv not connected, dropping {}", Arrays.toString(args));
            return;
        }
        try {
            byte[] line = (mapper.writeValueAsString(Map.of("command", List.of(args))) + "\n")
                    .getBytes(StandardCharsets.UTF_8);
            synchronized (this) {
                channel.write(ByteBuffer.wrap(line));
            }
        } catch (IOException e) {
            log.warn("mpv command {} failed: {}", args[0], e.getMessage());
        }
    }

    private void readLoop(SocketChannel channel) {
        try (BufferedReader reader = new BufferedReader(Channels.newReader(channel, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handleMessage(line);
            }
            log.info("mpv closed its IPC socket");
        } catch (IOException e) {
            if (socket != null) {
                log.warn("Lost mpv IPC connection: {}", e.getMessage());
            }
        } finally {
            close();
        }
    }
}
