package com.flagship.nft_marketplace.marketplace;

import com.flagship.nft_marketplace.marketplace.dto.AccountResponse;
import com.flagship.nft_marketplace.marketplace.dto.FundingRequest;
import com.flagship.nft_marketplace.marketplace.dto.ListingRequest;
import com.flagship.nft_marketplace.marketplace.dto.MarketItemResponse;
import com.flagship.nft_marketplace.marketplace.dto.MarketplaceInfoResponse;
import com.flagship.nft_marketplace.marketplace.dto.OwnershipTransferRequest;
import com.flagship.nft_marketplace.marketplace.dto.PurchaseRequest;
import com.flagship.nft_marketplace.marketplace.dto.ReceiptResponse;
import com.flagship.nft_marketplace.marketplace.dto.RoyaltyFeeRequest;
import com.flagship.nft_marketplace.marketplace.dto.TokenResponse;
import com.flagship.nft_marketplace.marketplace.dto.TokenTransferRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the marketplace.
 *
 * Writes answer 201 with the new receipt, or 200 with the stored receipt when
 * the Idempotency-Key header repeats an earlier request.
 */
@RestController
@RequestMapping("/api/marketplace")
@RequiredArgsConstructor
@Slf4j
public class MarketplaceController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final MarketplaceService marketplaceService;

    // ==================== Reads ====================

    @GetMapping
    public MarketplaceInfoResponse getInfo() {
        MarketplaceLedger ledger = marketplaceService.getLedger();
        return MarketplaceInfoResponse.builder()
            .name(ledger.getName())
            .symbol(ledger.getSymbol())
            .address(ledger.getAddress().toString())
            .owner(ledger.getOwner().toString())
            .artist(ledger.getArtist().toString())
            .royaltyFee(ledger.getRoyaltyFee())
            .totalSupply(ledger.totalSupply())
            .unsoldCount(ledger.getUnsoldTokens().size())
            .baseUri(ledger.getBaseUri())
            .contractBalance(ledger.contractBalance())
            .sequenceNumber(ledger.getSequenceNumber())
            .build();
    }

    @GetMapping("/items/unsold")
    public List<MarketItemResponse> getUnsoldItems() {
        return marketplaceService.getUnsoldItems().stream()
            .map(MarketItemResponse::from)
            .toList();
    }

    @GetMapping("/items/{tokenId}")
    public MarketItemResponse getItem(@PathVariable("tokenId") long tokenId) {
        return MarketItemResponse.from(marketplaceService.getItem(tokenId));
    }

    @GetMapping("/items/{tokenId}/receipts")
    public List<ReceiptResponse> getItemHistory(@PathVariable("tokenId") long tokenId) {
        return marketplaceService.getTokenHistory(tokenId).stream()
            .map(receipt -> ReceiptResponse.from(receipt, false))
            .toList();
    }

    @GetMapping("/accounts/{address}/tokens")
    public List<MarketItemResponse> getOwnedItems(@PathVariable("address") String address) {
        return marketplaceService.getOwnedItems(address).stream()
            .map(MarketItemResponse::from)
            .toList();
    }

    @GetMapping("/accounts/{address}")
    public AccountResponse getAccount(@PathVariable("address") String address) {
        return AccountResponse.builder()
            .address(address.toLowerCase())
            .tokenCount(marketplaceService.tokenCount(address))
            .funds(marketplaceService.funds(address))
            .build();
    }

    @GetMapping("/tokens/{tokenId}")
    public TokenResponse getToken(@PathVariable("tokenId") long tokenId) {
        return TokenResponse.builder()
            .tokenId(tokenId)
            .owner(marketplaceService.ownerOf(tokenId).toString())
            .tokenUri(marketplaceService.tokenUri(tokenId))
            .build();
    }

    @GetMapping("/receipts/{sequence}")
    public ResponseEntity<ReceiptResponse> getReceipt(@PathVariable("sequence") long sequence) {
        return marketplaceService.getReceipt(sequence)
            .map(receipt -> ResponseEntity.ok(ReceiptResponse.from(receipt, false)))
            .orElse(ResponseEntity.notFound().build());
    }

    // ==================== Writes ====================

    @PostMapping("/items/{tokenId}/purchase")
    public ResponseEntity<ReceiptResponse> purchase(
            @PathVariable("tokenId") long tokenId,
            @Valid @RequestBody PurchaseRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Purchase request: tokenId={}, buyer={}, value={}", tokenId, request.getBuyer(), request.getValue());
        return respond(marketplaceService.purchase(tokenId, request.getBuyer(), request.getValue(), idempotencyKey));
    }

    @PostMapping("/items/{tokenId}/listing")
    public ResponseEntity<ReceiptResponse> relist(
            @PathVariable("tokenId") long tokenId,
            @Valid @RequestBody ListingRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Listing request: tokenId={}, seller={}, price={}", tokenId, request.getSeller(), request.getPrice());
        return respond(marketplaceService.relist(
            tokenId, request.getSeller(), request.getPrice(), request.getValue(), idempotencyKey));
    }

    @PostMapping("/tokens/{tokenId}/transfer")
    public ResponseEntity<ReceiptResponse> transferToken(
            @PathVariable("tokenId") long tokenId,
            @Valid @RequestBody TokenTransferRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Transfer request: tokenId={}, from={}, to={}", tokenId, request.getFrom(), request.getTo());
        return respond(marketplaceService.transferToken(tokenId, request.getFrom(), request.getTo(), idempotencyKey));
    }

    @PutMapping("/royalty-fee")
    public ResponseEntity<ReceiptResponse> updateRoyaltyFee(
            @Valid @RequestBody RoyaltyFeeRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Royalty fee update request: caller={}, fee={}", request.getCaller(), request.getFee());
        return respond(marketplaceService.updateRoyaltyFee(request.getCaller(), request.getFee(), idempotencyKey));
    }

    @PutMapping("/owner")
    public ResponseEntity<ReceiptResponse> transferOwnership(
            @Valid @RequestBody OwnershipTransferRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Ownership transfer request: caller={}, newOwner={}", request.getCaller(), request.getNewOwner());
        return respond(marketplaceService.transferOwnership(request.getCaller(), request.getNewOwner(), idempotencyKey));
    }

    @PostMapping("/accounts/{address}/funding")
    public ResponseEntity<ReceiptResponse> fund(
            @PathVariable("address") String address,
            @Valid @RequestBody FundingRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Funding request: account={}, amount={}", address, request.getAmount());
        return respond(marketplaceService.fund(address, request.getAmount(), idempotencyKey));
    }

    private static ResponseEntity<ReceiptResponse> respond(OperationResult result) {
        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(ReceiptResponse.from(result.getReceipt(), result.isReplayed()));
    }
}
