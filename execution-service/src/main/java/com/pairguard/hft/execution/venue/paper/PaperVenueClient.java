package com.pairguard.hft.execution.venue.paper;

import com.pairguard.hft.domain.OrderSide;
import com.pairguard.hft.venue.CancelResult;
import com.pairguard.hft.venue.OpenOrder;
import com.pairguard.hft.venue.OpenOrdersResult;
import com.pairguard.hft.venue.OrderType;
import com.pairguard.hft.venue.OrderbookDepth;
import com.pairguard.hft.venue.PlaceOrderRequest;
import com.pairguard.hft.venue.PlaceOrderResult;
import com.pairguard.hft.venue.VenueClient;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory venue for PAPER mode and tests.
 * <p>
 * Books are set explicitly. A BUY priced at or above the ask takes up to the visible ask depth at the ask; the
 * rest (or any non-marketable order) rests until {@link #fill} or {@link #cancelOrder}. FOK orders that cannot
 * fully fill are rejected. Balance is debited on every fill.
 */
@Slf4j
public class PaperVenueClient implements VenueClient {

    private final Clock clock;
    private final Map<String, OrderbookDepth> books = new ConcurrentHashMap<>();
    private final Map<String, PaperOrder> openOrders = new ConcurrentHashMap<>();
    private final List<Consumer<PaperFill>> fillListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong orderSeq = new AtomicLong();
    private final AtomicInteger failPlacements = new AtomicInteger();
    private final AtomicInteger placeCalls = new AtomicInteger();
    private final AtomicInteger cancelCalls = new AtomicInteger();
    private volatile boolean openOrdersFailing;
    private BigDecimal balance;

    public PaperVenueClient(@NonNull Clock clock, @NonNull BigDecimal initialBalance) {
        this.clock = clock;
        this.balance = initialBalance;
    }

    public void setBook(String tokenId, BigDecimal bid, BigDecimal ask, BigDecimal bidDepth, BigDecimal askDepth) {
        books.put(tokenId, new OrderbookDepth(bid, ask, bidDepth, askDepth));
    }

    public synchronized void setBalance(BigDecimal balance) {
        this.balance = balance;
    }

    /**
     * The next {@code count} placements throw, as a transport failure would.
     */
    public void failNextPlacements(int count) {
        failPlacements.set(count);
    }

    public void setOpenOrdersFailing(boolean failing) {
        this.openOrdersFailing = failing;
    }

    public void onFill(Consumer<PaperFill> listener) {
        fillListeners.add(listener);
    }

    public int placeCalls() {
        return placeCalls.get();
    }

    public int cancelCalls() {
        return cancelCalls.get();
    }

    /**
     * Adds an order directly to the venue, as if placed by another session of this account.
     */
    public String injectOpenOrder(String tokenId, OrderSide side, BigDecimal price, BigDecimal size) {
        String orderId = nextOrderId();
        openOrders.put(orderId, new PaperOrder(orderId, tokenId, side, price, size, BigDecimal.ZERO, clock.instant()));
        return orderId;
    }

    /**
     * Removes an order without a cancel call, as a venue-side expiry or a missed fill would.
     */
    public void dropOpenOrder(String orderId) {
        openOrders.remove(orderId);
    }

    public Optional<OpenOrder> openOrder(String orderId) {
        return Optional.ofNullable(openOrders.get(orderId)).map(PaperOrder::toOpenOrder);
    }

    @Override
    public OrderbookDepth getOrderbookDepth(String tokenId) {
        return books.getOrDefault(tokenId, OrderbookDepth.empty());
    }

    @Override
    public PlaceOrderResult placeOrder(PlaceOrderRequest request) {
        placeCalls.incrementAndGet();
        if (failPlacements.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IllegalStateException("paper venue: simulated transport failure");
        }
        if (request.size().signum() <= 0 || request.price().signum() <= 0) {
            return PlaceOrderResult.rejected("invalid price or size");
        }

        OrderbookDepth book = getOrderbookDepth(request.tokenId());
        BigDecimal takePrice = request.side() == OrderSide.BUY ? book.topAsk() : book.topBid();
        BigDecimal visible = request.side() == OrderSide.BUY ? book.askDepth() : book.bidDepth();
        boolean marketable = takePrice != null && (request.side() == OrderSide.BUY
                ? request.price().compareTo(takePrice) >= 0
                : request.price().compareTo(takePrice) <= 0);
        BigDecimal immediate = marketable ? request.size().min(visible) : BigDecimal.ZERO;

        if (request.orderType() == OrderType.FOK && immediate.compareTo(request.size()) < 0) {
            return PlaceOrderResult.rejected("FOK not fully fillable");
        }
        if (request.side() == OrderSide.BUY) {
            BigDecimal worstCost = immediate.multiply(takePrice == null ? BigDecimal.ZERO : takePrice)
                    .add(request.size().subtract(immediate).multiply(request.price()));
            synchronized (this) {
                if (worstCost.compareTo(balance) > 0) {
                    return PlaceOrderResult.rejected("insufficient balance");
                }
            }
        }

        String orderId = nextOrderId();
        Instant now = clock.instant();
        if (immediate.signum() > 0) {
            debit(request.side(), immediate, takePrice);
            BigDecimal remainingDepth = visible.subtract(immediate);
            books.put(request.tokenId(), request.side() == OrderSide.BUY
                    ? new OrderbookDepth(book.topBid(), book.topAsk(), book.bidDepth(), remainingDepth)
                    : new OrderbookDepth(book.topBid(), book.topAsk(), remainingDepth, book.askDepth()));
            notifyFill(new PaperFill(orderId, request.tokenId(), request.side(), immediate, takePrice, now));
        }
        BigDecimal rest = request.size().subtract(immediate);
        if (rest.signum() > 0 && request.orderType() == OrderType.GTC) {
            openOrders.put(orderId, new PaperOrder(orderId, request.tokenId(), request.side(), request.price(),
                    request.size(), immediate, now));
        }
        log.debug("PAPER: placed {} {} {} @ {} immediate={} orderId={}",
                request.side(), request.size(), request.tokenId(), request.price(), immediate, orderId);
        return immediate.signum() > 0
                ? PlaceOrderResult.filled(orderId, immediate, takePrice)
                : PlaceOrderResult.accepted(orderId);
    }

    /**
     * Simulates a maker fill of a resting order.
     */
    public Optional<PaperFill> fill(String orderId, BigDecimal shares) {
        PaperOrder order = openOrders.get(orderId);
        if (order == null) {
            return Optional.empty();
        }
        BigDecimal qty = shares.min(order.remaining());
        PaperOrder updated = order.withMatched(order.sizeMatched().add(qty));
        if (updated.remaining().signum() <= 0) {
            openOrders.remove(orderId);
        } else {
            openOrders.put(orderId, updated);
        }
        debit(order.side(), qty, order.price());
        PaperFill fill = new PaperFill(orderId, order.tokenId(), order.side(), qty, order.price(), clock.instant());
        notifyFill(fill);
        return Optional.of(fill);
    }

    @Override
    public CancelResult cancelOrder(String orderId) {
        cancelCalls.incrementAndGet();
        if (openOrders.remove(orderId) == null) {
            return CancelResult.failed("unknown order " + orderId);
        }
        return CancelResult.ok();
    }

    @Override
    public OpenOrdersResult getOpenOrders() {
        if (openOrdersFailing) {
            return OpenOrdersResult.failed("paper venue: open orders unavailable");
        }
        List<OpenOrder> orders = new ArrayList<>();
        openOrders.values().stream()
                .sorted(Comparator.comparing(PaperOrder::createdAt))
                .forEach(o -> orders.add(o.toOpenOrder()));
        return OpenOrdersResult.of(orders);
    }

    @Override
    public synchronized BigDecimal getBalance() {
        return balance;
    }

    private synchronized void debit(OrderSide side, BigDecimal qty, BigDecimal price) {
        BigDecimal notional = qty.multiply(price);
        balance = side == OrderSide.BUY ? balance.subtract(notional) : balance.add(notional);
    }

    private void notifyFill(PaperFill fill) {
        for (Consumer<PaperFill> listener : fillListeners) {
            try {
                listener.accept(fill);
            } catch (RuntimeException e) {
                log.warn("PAPER: fill listener failed orderId={} error={}", fill.orderId(), e.toString());
            }
        }
    }

    private String nextOrderId() {
        return "paper-" + orderSeq.incrementAndGet();
    }

    public record PaperFill(String orderId, String tokenId, OrderSide side, BigDecimal shares, BigDecimal price, Instant at) {}

    private record PaperOrder(
            String orderId,
            String tokenId,
            OrderSide side,
            BigDecimal price,
            BigDecimal size,
            BigDecimal sizeMatched,
            Instant createdAt
    ) {
        BigDecimal remaining() {
            return size.subtract(sizeMatched);
        }

        PaperOrder withMatched(BigDecimal matched) {
            return new PaperOrder(orderId, tokenId, side, price, size, matched, createdAt);
        }

        OpenOrder toOpenOrder() {
            return new OpenOrder(orderId, tokenId, side, price, size, sizeMatched, createdAt);
        }
    }
}
