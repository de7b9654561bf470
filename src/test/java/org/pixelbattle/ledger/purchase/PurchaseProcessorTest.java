package org.pixelbattle.ledger.purchase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pixelbattle.junit.extensions.logging.ExpectLog;
import org.pixelbattle.junit.extensions.logging.LogLevel;
import org.pixelbattle.junit.extensions.logging.LogWatchExtension;
import org.pixelbattle.ledger.cycle.GameCycleController;
import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.model.Cell;
import org.pixelbattle.ledger.model.GameCycle;
import org.pixelbattle.ledger.model.GridProperties;
import org.pixelbattle.ledger.model.GridStore;
import org.pixelbattle.ledger.model.OwnershipLedger;
import org.pixelbattle.ledger.payment.PaymentSplitter;
import org.pixelbattle.ledger.payment.RevenueSplit;
import org.pixelbattle.ledger.pricing.PricingEngine;
import org.pixelbattle.ledger.prize.PrizeDistributor;
import org.pixelbattle.ledger.prize.WinnerResolver;
import org.pixelbattle.ledger.spi.ITransferGateway;
import org.pixelbattle.ledger.spi.TransferException;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for the purchase state machine against a mocked transfer gateway.
 */
@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class PurchaseProcessorTest {

    private static final ActorId ALICE = ActorId.of("alice");
    private static final ActorId BOB = ActorId.of("bob");
    private static final ActorId OPERATOR = ActorId.of("operator");
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(60);

    @Mock
    private ITransferGateway gateway;

    private GridStore grid;
    private OwnershipLedger ownership;
    private GameCycle cycle;
    private GameCycleController controller;
    private PurchaseProcessor processor;

    @BeforeEach
    void setUp() {
        grid = new GridStore(new GridProperties(4, 4), 100);
        ownership = new OwnershipLedger();
        cycle = new GameCycle(Duration.ofHours(1));
        controller = new GameCycleController(cycle, ownership, new WinnerResolver(), new PrizeDistributor(gateway));
        processor = new PurchaseProcessor(grid, ownership, controller, PricingEngine.defaults(),
            new PaymentSplitter(RevenueSplit.defaults()), gateway, OPERATOR);
        controller.start(T0);
    }

    @Test
    void process_firstPurchaseOfUnownedCell() throws Exception {
        final PurchaseReceipt receipt = processor.process(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100), T1);

        assertThat(receipt.listedPrice()).isEqualTo(100);
        assertThat(receipt.newPrice()).isEqualTo(110);
        assertThat(receipt.previousOwnerOptional()).isEmpty();
        assertThat(receipt.split().poolShare()).isEqualTo(99);
        assertThat(receipt.cycleId()).isEqualTo(1);
        assertThat(grid.get(0, 0)).isEqualTo(new Cell(ALICE, 110, "#ff0000", 1));
        assertThat(ownership.count(ALICE)).isEqualTo(1);
        assertThat(cycle.getPrizePool()).isEqualTo(99);
        assertThat(cycle.getLastActivityAt()).isEqualTo(T1);
        verify(gateway).transfer(OPERATOR, 1);
    }

    @Test
    void process_resalePaysPreviousOwnerBeforeOperator() throws Exception {
        processor.process(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100), T1);

        final PurchaseReceipt receipt = processor.process(BOB, new PurchaseOrder(0, 0, "#0000ff", 110), T1);

        assertThat(receipt.previousOwner()).isEqualTo(ALICE);
        assertThat(receipt.newPrice()).isEqualTo(121);
        assertThat(ownership.count(ALICE)).isZero();
        assertThat(ownership.count(BOB)).isEqualTo(1);
        assertThat(cycle.getPrizePool()).isEqualTo(99 + 17);
        final InOrder order = inOrder(gateway);
        order.verify(gateway).transfer(OPERATOR, 1);
        order.verify(gateway).transfer(ALICE, 92);
        order.verify(gateway).transfer(OPERATOR, 1);
    }

    @Test
    void process_overpaymentFlowsIntoSplit() throws Exception {
        final PurchaseReceipt receipt = processor.process(ALICE, new PurchaseOrder(1, 1, "#ff0000", 1_000), T1);

        assertThat(receipt.amountTendered()).isEqualTo(1_000);
        assertThat(receipt.newPrice()).isEqualTo(110);
        assertThat(cycle.getPrizePool()).isEqualTo(990);
        verify(gateway).transfer(OPERATOR, 10);
    }

    @Test
    void process_rejectsWhenNoCycleIsActive() {
        cycle.close();

        assertRejected(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100), PurchaseError.GAME_NOT_ACTIVE);
    }

    @Test
    void process_rejectsOutOfBounds() {
        assertRejected(ALICE, new PurchaseOrder(4, 0, "#ff0000", 100), PurchaseError.OUT_OF_BOUNDS);
        assertRejected(ALICE, new PurchaseOrder(0, -1, "#ff0000", 100), PurchaseError.OUT_OF_BOUNDS);
    }

    @Test
    void process_rejectsEmptyTag() {
        assertRejected(ALICE, new PurchaseOrder(0, 0, "", 100), PurchaseError.INVALID_TAG);
        assertRejected(ALICE, new PurchaseOrder(0, 0, null, 100), PurchaseError.INVALID_TAG);
    }

    @Test
    void process_rejectsInsufficientPayment() throws Exception {
        assertRejected(ALICE, new PurchaseOrder(0, 0, "#ff0000", 99), PurchaseError.INSUFFICIENT_PAYMENT);

        processor.process(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100), T1);
        assertRejected(BOB, new PurchaseOrder(0, 0, "#00ff00", 109), PurchaseError.INSUFFICIENT_PAYMENT);
    }

    @Test
    void process_rejectsRepurchaseByOwner() throws Exception {
        processor.process(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100), T1);

        assertRejected(ALICE, new PurchaseOrder(0, 0, "#00ff00", 500), PurchaseError.ALREADY_OWNER);
    }

    @Test
    void process_usesLazilyResetPriceForStaleCell() throws Exception {
        grid.set(2, 2, new Cell(ALICE, 5_000, "#ff0000", 0));

        final PurchaseReceipt receipt = processor.process(ALICE, new PurchaseOrder(2, 2, "#00ff00", 100), T1);

        assertThat(receipt.listedPrice()).isEqualTo(100);
        assertThat(receipt.previousOwner()).isNull();
        assertThat(grid.get(2, 2).price()).isEqualTo(110);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Purchase of \\(0, 0\\) by alice rolled back.*")
    void process_rollsBackWhenOperatorTransferFails() throws Exception {
        doThrow(new TransferException(OPERATOR, 1, "operator offline")).when(gateway).transfer(eq(OPERATOR), anyLong());

        final PurchaseRejectedException ex = assertRejected(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100),
            PurchaseError.TRANSFER_FAILED);

        assertThat(ex.getCause()).isInstanceOf(TransferException.class);
        assertThat(grid.get(0, 0)).isEqualTo(Cell.fresh(100));
        assertThat(ownership.isEmpty()).isTrue();
        assertThat(cycle.getPrizePool()).isZero();
        assertThat(cycle.getLastActivityAt()).isEqualTo(T0);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Purchase of \\(0, 0\\) by bob rolled back.*")
    void process_reversesOwnerPaymentWhenOperatorTransferFails() throws Exception {
        processor.process(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100), T1);
        final Cell beforeResale = grid.get(0, 0);
        doThrow(new TransferException(OPERATOR, 1, "operator offline")).when(gateway).transfer(eq(OPERATOR), anyLong());

        assertRejected(BOB, new PurchaseOrder(0, 0, "#0000ff", 110), PurchaseError.TRANSFER_FAILED);

        verify(gateway).transfer(ALICE, 92);
        verify(gateway).reverse(ALICE, 92);
        assertThat(grid.get(0, 0)).isEqualTo(beforeResale);
        assertThat(ownership.count(ALICE)).isEqualTo(1);
        assertThat(ownership.count(BOB)).isZero();
        assertThat(cycle.getPrizePool()).isEqualTo(99);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Purchase of \\(0, 0\\) by bob rolled back.*")
    void process_rollsBackWhenPreviousOwnerCannotBePaid() throws Exception {
        processor.process(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100), T1);
        doThrow(new TransferException(ALICE, 92, "rejected")).when(gateway).transfer(ALICE, 92);

        assertRejected(BOB, new PurchaseOrder(0, 0, "#0000ff", 110), PurchaseError.TRANSFER_FAILED);

        verify(gateway, never()).reverse(eq(ALICE), anyLong());
        assertThat(grid.get(0, 0).owner()).isEqualTo(ALICE);
        assertThat(cycle.getPrizePool()).isEqualTo(99);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Purchase of \\(0, 0\\) by bob rolled back.*")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Could not reverse transfer of 92 to alice.*")
    void process_reportsFailedReversal() throws Exception {
        processor.process(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100), T1);
        doThrow(new TransferException(OPERATOR, 1, "operator offline")).when(gateway).transfer(eq(OPERATOR), anyLong());
        doThrow(new TransferException(ALICE, 92, "already spent")).when(gateway).reverse(ALICE, 92);

        final PurchaseRejectedException ex = assertRejected(BOB, new PurchaseOrder(0, 0, "#0000ff", 110),
            PurchaseError.TRANSFER_FAILED);

        assertThat(ex.getCause().getSuppressed()).hasSize(1);
        assertThat(grid.get(0, 0).owner()).isEqualTo(ALICE);
    }

    @Test
    void process_rollsBackAndRethrowsUnexpectedGatewayErrors() throws Exception {
        doThrow(new IllegalStateException("boom")).when(gateway).transfer(eq(OPERATOR), anyLong());

        assertThatThrownBy(() -> processor.process(ALICE, new PurchaseOrder(0, 0, "#ff0000", 100), T1))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");

        assertThat(grid.get(0, 0)).isEqualTo(Cell.fresh(100));
        assertThat(ownership.isEmpty()).isTrue();
        assertThat(cycle.getPrizePool()).isZero();
    }

    @Test
    void process_validationFailuresDoNotTouchGateway() {
        assertRejected(ALICE, new PurchaseOrder(0, 0, "#ff0000", 1), PurchaseError.INSUFFICIENT_PAYMENT);

        verifyNoInteractions(gateway);
        assertThat(grid.getTouchedIndices()).isEmpty();
    }

    private PurchaseRejectedException assertRejected(final ActorId buyer, final PurchaseOrder order,
                                                     final PurchaseError expected) {
        final PurchaseRejectedException ex = org.junit.jupiter.api.Assertions.assertThrows(
            PurchaseRejectedException.class, () -> processor.process(buyer, order, T1));
        assertThat(ex.getError()).isEqualTo(expected);
        return ex;
    }
}
