package com.fintech.escrow.ledger;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Events emitted by the escrow contract.
 * <p>
 * Consumers dispatch through {@link Visitor} so that adding an event type
 * breaks every handler that does not cover it.
 */
public interface LedgerEvent {

    long tradeId();

    /** Event name as it appears in the contract ABI. */
    String eventName();

    /** Event arguments keyed by ABI parameter name, for audit payloads. */
    Map<String, Object> arguments();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitEscrowCreated(EscrowCreated event);

        R visitFunded(Funded event);

        R visitDeliveryConfirmed(DeliveryConfirmed event);

        R visitReleased(Released event);

        R visitDisputed(Disputed event);

        R visitResolved(Resolved event);

        R visitTimeoutRefund(TimeoutRefund event);
    }

    record EscrowCreated(long tradeId, String buyer, String seller, BigInteger amount,
                         String metadata) implements LedgerEvent {
        @Override
        public String eventName() {
            return "EscrowCreated";
        }

        @Override
        public Map<String, Object> arguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("tradeId", tradeId);
            args.put("buyer", buyer);
            args.put("seller", seller);
            args.put("amount", amount.toString());
            args.put("metadata", metadata);
            return args;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEscrowCreated(this);
        }
    }

    record Funded(long tradeId, String payer, BigInteger amount) implements LedgerEvent {
        @Override
        public String eventName() {
            return "Funded";
        }

        @Override
        public Map<String, Object> arguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("tradeId", tradeId);
            args.put("payer", payer);
            args.put("amount", amount.toString());
            return args;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunded(this);
        }
    }

    record DeliveryConfirmed(long tradeId, String confirmer) implements LedgerEvent {
        @Override
        public String eventName() {
            return "DeliveryConfirmed";
        }

        @Override
        public Map<String, Object> arguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("tradeId", tradeId);
            args.put("confirmer", confirmer);
            return args;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDeliveryConfirmed(this);
        }
    }

    record Released(long tradeId, String to, BigInteger amount, BigInteger fee) implements LedgerEvent {
        @Override
        public String eventName() {
            return "Released";
        }

        @Override
        public Map<String, Object> arguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("tradeId", tradeId);
            args.put("to", to);
            args.put("amount", amount.toString());
            args.put("fee", fee.toString());
            return args;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReleased(this);
        }
    }

    record Disputed(long tradeId, String by, String reason) implements LedgerEvent {
        @Override
        public String eventName() {
            return "Disputed";
        }

        @Override
        public Map<String, Object> arguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("tradeId", tradeId);
            args.put("by", by);
            args.put("reason", reason);
            return args;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDisputed(this);
        }
    }

    record Resolved(long tradeId, String to, BigInteger amount, String resolution) implements LedgerEvent {
        @Override
        public String eventName() {
            return "Resolved";
        }

        @Override
        public Map<String, Object> arguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("tradeId", tradeId);
            args.put("to", to);
            args.put("amount", amount.toString());
            args.put("resolution", resolution);
            return args;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitResolved(this);
        }
    }

    record TimeoutRefund(long tradeId, String buyer, BigInteger amount) implements LedgerEvent {
        @Override
        public String eventName() {
            return "TimeoutRefund";
        }

        @Override
        public Map<String, Object> arguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("tradeId", tradeId);
            args.put("buyer", buyer);
            args.put("amount", amount.toString());
            return args;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTimeoutRefund(this);
        }
    }
}
