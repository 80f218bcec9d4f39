package com.lendmatch.api.controller;

import com.lendmatch.api.dto.request.LiquidationRequest;
import com.lendmatch.api.dto.request.ManagerApprovalRequest;
import com.lendmatch.api.dto.request.PositionRequest;
import com.lendmatch.api.dto.response.FlowResponse;
import com.lendmatch.api.dto.response.HealthResponse;
import com.lendmatch.auth.PermissionManager;
import com.lendmatch.config.MatchingConfig;
import com.lendmatch.domain.model.UserPosition;
import com.lendmatch.positions.CollateralResult;
import com.lendmatch.positions.LiquidationResult;
import com.lendmatch.positions.PositionsLens;
import com.lendmatch.positions.PositionsManager;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for position flows and position queries.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/positions/supply, /borrow, /repay, /withdraw -- money flows</li>
 *   <li>POST /api/positions/supply-collateral, /withdraw-collateral -- collateral flows</li>
 *   <li>POST /api/positions/liquidate -- liquidate an unhealthy borrower</li>
 *   <li>POST /api/positions/managers -- approve or revoke a position manager</li>
 *   <li>GET /api/positions/{asset}/{user} -- a user's balances in one market</li>
 *   <li>GET /api/positions/users/{user}/health -- liquidity data and health factor</li>
 * </ul>
 *
 * <p>When a flow request omits {@code maxLoops}, the configured default iterations of
 * that flow apply.
 */
@RestController
@RequestMapping("/api/positions")
public class PositionsController {

    private static final Logger log = LoggerFactory.getLogger(PositionsController.class);

    private final PositionsManager positionsManager;
    private final PositionsLens positionsLens;
    private final PermissionManager permissionManager;
    private final MatchingConfig matchingConfig;

    public PositionsController(
            PositionsManager positionsManager,
            PositionsLens positionsLens,
            PermissionManager permissionManager,
            MatchingConfig matchingConfig) {
        this.positionsManager = positionsManager;
        this.positionsLens = positionsLens;
        this.permissionManager = permissionManager;
        this.matchingConfig = matchingConfig;
    }

    // ---- Money flows ----

    @PostMapping("/supply")
    public ResponseEntity<FlowResponse> supply(@Valid @RequestBody PositionRequest request) {
        int maxLoops = loopsOrDefault(request, matchingConfig.getDefaultIterations().getSupply());
        return ResponseEntity.ok(FlowResponse.from(positionsManager.supply(
                request.getCaller(), request.getAsset(), request.getAmount(), request.getOnBehalf(), maxLoops)));
    }

    @PostMapping("/borrow")
    public ResponseEntity<FlowResponse> borrow(@Valid @RequestBody PositionRequest request) {
        int maxLoops = loopsOrDefault(request, matchingConfig.getDefaultIterations().getBorrow());
        return ResponseEntity.ok(FlowResponse.from(positionsManager.borrow(
                request.getCaller(),
                request.getAsset(),
                request.getAmount(),
                request.getOnBehalf(),
                receiverOrSelf(request),
                maxLoops)));
    }

    @PostMapping("/repay")
    public ResponseEntity<FlowResponse> repay(@Valid @RequestBody PositionRequest request) {
        int maxLoops = loopsOrDefault(request, matchingConfig.getDefaultIterations().getRepay());
        return ResponseEntity.ok(FlowResponse.from(positionsManager.repay(
                request.getCaller(), request.getAsset(), request.getAmount(), request.getOnBehalf(), maxLoops)));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<FlowResponse> withdraw(@Valid @RequestBody PositionRequest request) {
        int maxLoops = loopsOrDefault(request, matchingConfig.getDefaultIterations().getWithdraw());
        return ResponseEntity.ok(FlowResponse.from(positionsManager.withdraw(
                request.getCaller(),
                request.getAsset(),
                request.getAmount(),
                request.getOnBehalf(),
                receiverOrSelf(request),
                maxLoops)));
    }

    // ---- Collateral ----

    @PostMapping("/supply-collateral")
    public ResponseEntity<CollateralResult> supplyCollateral(@Valid @RequestBody PositionRequest request) {
        return ResponseEntity.ok(positionsManager.supplyCollateral(
                request.getCaller(), request.getAsset(), request.getAmount(), request.getOnBehalf()));
    }

    @PostMapping("/withdraw-collateral")
    public ResponseEntity<CollateralResult> withdrawCollateral(@Valid @RequestBody PositionRequest request) {
        return ResponseEntity.ok(positionsManager.withdrawCollateral(
                request.getCaller(),
                request.getAsset(),
                request.getAmount(),
                request.getOnBehalf(),
                receiverOrSelf(request)));
    }

    // ---- Liquidation ----

    @PostMapping("/liquidate")
    public ResponseEntity<LiquidationResult> liquidate(@Valid @RequestBody LiquidationRequest request) {
        return ResponseEntity.ok(positionsManager.liquidate(
                request.getCaller(),
                request.getBorrowAsset(),
                request.getCollateralAsset(),
                request.getBorrower(),
                request.getMaxDebtToCover()));
    }

    // ---- Permissions ----

    @PostMapping("/managers")
    public ResponseEntity<Map<String, Object>> approveManager(@Valid @RequestBody ManagerApprovalRequest request) {
        log.info(
                "Manager approval requested: {} -> {} ({})",
                request.getDelegator(),
                request.getManager(),
                request.isAllowed());
        permissionManager.approveManager(request.getDelegator(), request.getManager(), request.isAllowed());
        return ResponseEntity.ok(Map.of(
                "delegator", request.getDelegator(),
                "manager", request.getManager(),
                "allowed", request.isAllowed()));
    }

    // ---- Queries ----

    @GetMapping("/{asset}/{user}")
    public ResponseEntity<UserPosition> getPosition(@PathVariable String asset, @PathVariable String user) {
        return ResponseEntity.ok(positionsLens.position(asset, user));
    }

    @GetMapping("/users/{user}/health")
    public ResponseEntity<HealthResponse> getHealth(@PathVariable String user) {
        return ResponseEntity.ok(HealthResponse.from(user, positionsLens.liquidityData(user)));
    }

    private int loopsOrDefault(PositionRequest request, int defaultLoops) {
        return request.getMaxLoops() != null ? request.getMaxLoops() : defaultLoops;
    }

    private String receiverOrSelf(PositionRequest request) {
        return request.getReceiver() != null ? request.getReceiver() : request.getOnBehalf();
    }
}
