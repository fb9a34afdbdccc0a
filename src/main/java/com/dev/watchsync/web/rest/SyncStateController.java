package com.dev.watchsync.web.rest;

import com.dev.watchsync.relay.RelayService;
import com.dev.watchsync.web.dto.SyncStateResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rooms/{code}/sync")
public class SyncStateController {

    private final RelayService relayService;

    public SyncStateController(RelayService relayService) {
        this.relayService = relayService;
    }

    @GetMapping
    public SyncStateResponse getState(@PathVariable String code) {
        return relayService.getState(code);
    }
}
