package com.synthetic.cycleengine.api;

import com.synthetic.cycleengine.api.dto.OracleUpdateRequest;
import com.synthetic.cycleengine.domain.model.OracleQuote;
import com.synthetic.cycleengine.infra.disruptor.ProtocolCommandGateway;
import com.synthetic.cycleengine.infra.oracle.FeedAssetOracle;
import com.synthetic.cycleengine.infra.oracle.OracleFeeds;
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

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Push endpoint for the external price feeder.
 */
@Slf4j
@RestController
@RequestMapping("/api/oracle/{symbol}")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class OracleController {

    private final OracleFeeds oracleFeeds;
    private final ProtocolCommandGateway gateway;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<Map<String, Object>> push(@PathVariable String symbol, @RequestBody OracleUpdateRequest body) {
        FeedAssetOracle feed = oracleFeeds.get(symbol);
        OracleQuote quote = new OracleQuote(body.open(), body.high(), body.low(), body.close(),
                Instant.ofEpochSecond(body.timestamp()));
        gateway.run(feed.symbol(), "oracle.update", () -> feed.update(quote, body.marketOpen(), clock.instant()));
        log.info("[Oracle API] {} close={} marketOpen={} split={}",
                feed.symbol(), body.close(), body.marketOpen(), feed.splitDetected());
        return ResponseEntity.ok(snapshot(feed));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> latest(@PathVariable String symbol) {
        return ResponseEntity.ok(snapshot(oracleFeeds.get(symbol)));
    }

    private Map<String, Object> snapshot(FeedAssetOracle feed) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", feed.symbol());
        body.put("quote", feed.latestQuote());
        body.put("marketOpen", feed.isMarketOpen());
        body.put("lastUpdate", feed.lastUpdateTimestamp());
        body.put("splitDetected", feed.splitDetected());
        body.put("preSplitPrice", feed.preSplitPrice());
        return body;
    }
}
