package com.synthetic.cycleengine.api;

import com.synthetic.cycleengine.api.dto.AdminTargetRequest;
import com.synthetic.cycleengine.api.dto.RebalanceRequest;
import com.synthetic.cycleengine.api.dto.ResolveDeviationRequest;
import com.synthetic.cycleengine.domain.model.CycleHistoryRecord;
import com.synthetic.cycleengine.domain.model.CycleStatus;
import com.synthetic.cycleengine.domain.model.SettlementResult;
import com.synthetic.cycleengine.domain.repository.CycleHistoryRepository;
import com.synthetic.cycleengine.domain.service.AssetPool;
import com.synthetic.cycleengine.domain.service.AssetPoolRegistry;
import com.synthetic.cycleengine.infra.disruptor.ProtocolCommandGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/pools/{symbol}/cycle")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class CycleController {

    private final AssetPoolRegistry registry;
    private final ProtocolCommandGateway gateway;
    private final CycleHistoryRepository historyRepository;

    @GetMapping
    public ResponseEntity<CycleStatus> status(@PathVariable String symbol) {
        AssetPool pool = registry.get(symbol);
        return ResponseEntity.ok(gateway.execute(pool.symbol(), "cycle.status", () -> pool.orchestrator().status()));
    }

    @GetMapping("/history")
    public ResponseEntity<List<CycleHistoryRecord>> history(@PathVariable String symbol) {
        AssetPool pool = registry.get(symbol);
        return ResponseEntity.ok(historyRepository.findBySymbolOrderByCycleDesc(pool.symbol()));
    }

    @PostMapping("/offchain")
    public ResponseEntity<CycleStatus> initiateOffchain(@PathVariable String symbol) {
        AssetPool pool = registry.get(symbol);
        CycleStatus status = gateway.execute(pool.symbol(), "cycle.offchain", () -> {
            pool.orchestrator().initiateOffchainRebalance();
            return pool.orchestrator().status();
        });
        return ResponseEntity.ok(status);
    }

    @PostMapping("/onchain")
    public ResponseEntity<CycleStatus> initiateOnchain(@PathVariable String symbol) {
        AssetPool pool = registry.get(symbol);
        CycleStatus status = gateway.execute(pool.symbol(), "cycle.onchain", () -> {
            pool.orchestrator().initiateOnchainRebalance();
            return pool.orchestrator().status();
        });
        return ResponseEntity.ok(status);
    }

    @PostMapping("/resolve-deviation")
    public ResponseEntity<Map<String, Object>> resolveDeviation(@PathVariable String symbol,
                                                                @RequestBody ResolveDeviationRequest body) {
        AssetPool pool = registry.get(symbol);
        gateway.run(pool.symbol(), "cycle.resolveDeviation", () -> pool.orchestrator()
                .resolvePriceDeviation(body.admin(), body.split(), body.ratioNum(), body.ratioDen()));
        return ResponseEntity.ok(Map.of(
                "success", true,
                "symbol", pool.symbol(),
                "split", body.split(),
                "message", "price deviation accepted for the current cycle"));
    }

    @PostMapping("/rebalance")
    public ResponseEntity<SettlementResult> rebalance(@PathVariable String symbol, @RequestBody RebalanceRequest body) {
        AssetPool pool = registry.get(symbol);
        SettlementResult result = gateway.execute(pool.symbol(), "cycle.rebalance", () -> body.amount() == null
                ? pool.orchestrator().rebalancePool(body.lp(), body.price())
                : pool.orchestrator().rebalancePool(body.lp(), body.price(), body.amount(),
                        Boolean.TRUE.equals(body.contribution())));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/force")
    public ResponseEntity<SettlementResult> force(@PathVariable String symbol, @RequestBody AdminTargetRequest body) {
        AssetPool pool = registry.get(symbol);
        SettlementResult result = gateway.execute(pool.symbol(), "cycle.force",
                () -> pool.orchestrator().forceRebalanceLP(body.admin(), body.account()));
        if (result.halted()) {
            log.error("[Cycle API] {} halted by forced settlement of {}", pool.symbol(), body.account());
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/collect-fee")
    public ResponseEntity<Map<String, Object>> collectFee(@PathVariable String symbol,
                                                          @RequestBody AdminTargetRequest body) {
        AssetPool pool = registry.get(symbol);
        BigDecimal fee = gateway.execute(pool.symbol(), "cycle.collectFee",
                () -> pool.orchestrator().collectProtocolFee(body.admin(), body.account()));
        return ResponseEntity.ok(Map.of("success", true, "symbol", pool.symbol(), "collected", fee));
    }
}
