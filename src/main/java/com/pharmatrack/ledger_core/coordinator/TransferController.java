package com.pharmatrack.ledger_core.coordinator;

import com.pharmatrack.ledger_core.coordinator.dto.TransferRequest;
import com.pharmatrack.ledger_core.coordinator.dto.TransferResponse;
import com.pharmatrack.ledger_core.lot.LotRegistry;
import com.pharmatrack.ledger_core.stock.EntityRef;
import com.pharmatrack.ledger_core.stock.MovementReference;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for coordinated transfers (stock plus journal posting).
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final LedgerCoordinator ledgerCoordinator;
    private final LotRegistry lotRegistry;

    @PostMapping("/transfers")
    public ResponseEntity<TransferResponse> executeTransfer(@Valid @RequestBody TransferRequest request,
                                                            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        log.info("Received transfer request: lot={}, quantity={}, unitValue={}",
            request.getLotId(), request.getQuantity(), request.getUnitValue());

        TransferResult result = ledgerCoordinator.executeTransfer(
            EntityRef.of(request.getSellerKind(), request.getSellerId()),
            EntityRef.of(request.getBuyerKind(), request.getBuyerId()),
            request.getLotId(),
            request.getQuantity(),
            request.getUnitValue(),
            MovementReference.of(request.getReferenceId(), request.getReferenceKind()),
            actorId,
            lotRegistry.isLotUsable(request.getLotId())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(result));
    }
}
