package com.lendmatch.api.controller;

import com.lendmatch.api.dto.request.CreateMarketRequest;
import com.lendmatch.api.dto.request.MarketFlagRequest;
import com.lendmatch.api.dto.request.PauseRequest;
import com.lendmatch.domain.model.MarketSnapshot;
import com.lendmatch.positions.PositionsLens;
import com.lendmatch.service.MarketService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for market listing and operator switches.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/markets -- create a market (idempotent)</li>
 *   <li>GET /api/markets -- all markets</li>
 *   <li>GET /api/markets/{asset} -- one market</li>
 *   <li>PUT /api/markets/{asset}/pause -- pause or unpause one action, or all</li>
 *   <li>PUT /api/markets/{asset}/p2p-disabled -- switch P2P matching off or on</li>
 *   <li>PUT /api/markets/{asset}/deprecated -- deprecate (borrow must be paused first)</li>
 *   <li>PUT /api/markets/{asset}/collateral -- allow or forbid the asset as collateral</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/markets")
public class MarketController {

    private final MarketService marketService;
    private final PositionsLens positionsLens;

    public MarketController(MarketService marketService, PositionsLens positionsLens) {
        this.marketService = marketService;
        this.positionsLens = positionsLens;
    }

    @PostMapping
    public ResponseEntity<MarketSnapshot> createMarket(@Valid @RequestBody CreateMarketRequest request) {
        marketService.createMarket(request.getAsset(), request.getReserveFactor(), request.getP2pIndexCursor());
        return ResponseEntity.ok(positionsLens.market(request.getAsset()));
    }

    @GetMapping
    public ResponseEntity<List<MarketSnapshot>> getMarkets() {
        return ResponseEntity.ok(positionsLens.markets());
    }

    @GetMapping("/{asset}")
    public ResponseEntity<MarketSnapshot> getMarket(@PathVariable String asset) {
        return ResponseEntity.ok(positionsLens.market(asset));
    }

    @PutMapping("/{asset}/pause")
    public ResponseEntity<MarketSnapshot> setPaused(@PathVariable String asset, @RequestBody PauseRequest request) {
        if (request.getAction() == null) {
            marketService.setIsPaused(asset, request.isPaused());
        } else {
            marketService.setPauseStatus(asset, request.getAction(), request.isPaused());
        }
        return ResponseEntity.ok(positionsLens.market(asset));
    }

    @PutMapping("/{asset}/p2p-disabled")
    public ResponseEntity<MarketSnapshot> setP2PDisabled(
            @PathVariable String asset, @RequestBody MarketFlagRequest request) {
        marketService.setIsP2PDisabled(asset, request.isEnabled());
        return ResponseEntity.ok(positionsLens.market(asset));
    }

    @PutMapping("/{asset}/deprecated")
    public ResponseEntity<MarketSnapshot> setDeprecated(
            @PathVariable String asset, @RequestBody MarketFlagRequest request) {
        marketService.setIsDeprecated(asset, request.isEnabled());
        return ResponseEntity.ok(positionsLens.market(asset));
    }

    @PutMapping("/{asset}/collateral")
    public ResponseEntity<MarketSnapshot> setCollateral(
            @PathVariable String asset, @RequestBody MarketFlagRequest request) {
        marketService.setIsCollateral(asset, request.isEnabled());
        return ResponseEntity.ok(positionsLens.market(asset));
    }
}
