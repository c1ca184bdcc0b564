package com.pharmatrack.ledger_core.stock;

import com.pharmatrack.ledger_core.lot.LotRegistry;
import com.pharmatrack.ledger_core.stock.dto.BalanceResponse;
import com.pharmatrack.ledger_core.stock.dto.DualMovementResponse;
import com.pharmatrack.ledger_core.stock.dto.MovementResponse;
import com.pharmatrack.ledger_core.stock.dto.RecordMovementRequest;
import com.pharmatrack.ledger_core.stock.dto.SaleRequest;
import com.pharmatrack.ledger_core.stock.dto.StockTransferRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for stock movements and balances.
 *
 * Lot usability is resolved through the {@link LotRegistry} here, before the
 * service enters any critical section.
 */
@RestController
@RequestMapping("/api/stock")
@RequiredArgsConstructor
@Slf4j
public class StockController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final StockService stockService;
    private final LotRegistry lotRegistry;

    @GetMapping("/{entityKind}/{entityId}/lots/{lotId}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("entityKind") EntityKind entityKind,
                                                      @PathVariable("entityId") UUID entityId,
                                                      @PathVariable("lotId") UUID lotId) {
        long balance = stockService.getBalance(entityKind, entityId, lotId);
        return ResponseEntity.ok(new BalanceResponse(entityKind, entityId, lotId, balance));
    }

    @GetMapping("/{entityKind}/{entityId}/lots/{lotId}/movements")
    public ResponseEntity<List<MovementResponse>> getMovementHistory(@PathVariable("entityKind") EntityKind entityKind,
                                                                     @PathVariable("entityId") UUID entityId,
                                                                     @PathVariable("lotId") UUID lotId) {
        List<MovementResponse> history = stockService.getMovementHistory(entityKind, entityId, lotId)
            .stream()
            .map(MovementResponse::from)
            .toList();
        return ResponseEntity.ok(history);
    }

    @PostMapping("/movements")
    public ResponseEntity<MovementResponse> recordMovement(@Valid @RequestBody RecordMovementRequest request,
                                                           @RequestHeader(ACTOR_HEADER) UUID actorId) {
        log.info("Received movement request: kind={}, quantity={}", request.getMovementKind(), request.getQuantity());

        Movement movement = stockService.recordMovement(
            request.getEntityKind(),
            request.getEntityId(),
            request.getLotId(),
            request.getMovementKind(),
            request.getQuantity(),
            MovementReference.of(request.getReferenceId(), request.getReferenceKind()),
            actorId,
            lotRegistry.isLotUsable(request.getLotId())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(MovementResponse.from(movement));
    }

    @PostMapping("/sales")
    public ResponseEntity<MovementResponse> processSale(@Valid @RequestBody SaleRequest request,
                                                        @RequestHeader(ACTOR_HEADER) UUID actorId) {
        Movement movement = stockService.processSingleSale(
            EntityRef.of(request.getEntityKind(), request.getEntityId()),
            request.getLotId(),
            request.getQuantity(),
            MovementReference.of(request.getReferenceId(), request.getReferenceKind()),
            actorId,
            lotRegistry.isLotUsable(request.getLotId())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(MovementResponse.from(movement));
    }

    @PostMapping("/transfers")
    public ResponseEntity<DualMovementResponse> processTransfer(@Valid @RequestBody StockTransferRequest request,
                                                                @RequestHeader(ACTOR_HEADER) UUID actorId) {
        DualMovement dual = stockService.processDualMovement(
            EntityRef.of(request.getSellerKind(), request.getSellerId()),
            EntityRef.of(request.getBuyerKind(), request.getBuyerId()),
            request.getLotId(),
            request.getQuantity(),
            MovementReference.of(request.getReferenceId(), request.getReferenceKind()),
            actorId,
            lotRegistry.isLotUsable(request.getLotId())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(DualMovementResponse.from(dual));
    }
}
