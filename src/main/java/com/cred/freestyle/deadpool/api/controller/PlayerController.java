package com.cred.freestyle.deadpool.api.controller;

import com.cred.freestyle.deadpool.api.dto.PlayerRequest;
import com.cred.freestyle.deadpool.domain.model.Player;
import com.cred.freestyle.deadpool.service.SeasonSetupService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for player registration.
 *
 * @author Deadpool Team
 */
@RestController
@RequestMapping("/api/v1/players")
public class PlayerController {

    private static final Logger logger = LoggerFactory.getLogger(PlayerController.class);

    private final SeasonSetupService seasonSetupService;

    public PlayerController(SeasonSetupService seasonSetupService) {
        this.seasonSetupService = seasonSetupService;
    }

    /**
     * Register a player. Registering an existing id returns the stored player unchanged.
     */
    @PostMapping
    public ResponseEntity<Player> registerPlayer(
            @Valid @RequestBody PlayerRequest request
    ) {
        Player player = seasonSetupService.registerPlayer(
                request.getPlayerId(), request.getFirstName(), request.getLastName());
        logger.info("Registered player: {}", player.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(player);
    }
}
