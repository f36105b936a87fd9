package com.fintech.escrow.ledger;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.EventValues;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.tx.Contract;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * ABI of the deployed HedgeEscrow contract: event definitions, call
 * encoding and log decoding.
 * <p>
 * Solidity equivalent:
 * contract HedgeEscrow is Ownable, ReentrancyGuard {
 *     enum State { AWAITING_FUND, FUNDED, AWAITING_DELIVERY, COMPLETE, DISPUTED }
 *
 *     event EscrowCreated(uint256 indexed tradeId, address indexed buyer, address indexed seller, uint256 amount, string metadata);
 *     event Funded(uint256 indexed tradeId, address indexed payer, uint256 amount);
 *     event DeliveryConfirmed(uint256 indexed tradeId, address indexed confirmer);
 *     event Released(uint256 indexed tradeId, address indexed to, uint256 amount, uint256 fee);
 *     event Disputed(uint256 indexed tradeId, address indexed by, string reason);
 *     event Resolved(uint256 indexed tradeId, address indexed to, uint256 amount, string resolution);
 *     event TimeoutRefund(uint256 indexed tradeId, address indexed buyer, uint256 amount);
 *
 *     function getTrade(uint256 tradeId) external view returns (address buyer, address seller,
 *         uint256 amount, uint8 state, uint256 createdAt, uint256 timeoutAt, string memory metadata);
 * }
 */
public final class HedgeEscrowAbi {

    public static final String FUNC_GETTRADE = "getTrade";

    // Events
    public static final Event ESCROW_CREATED_EVENT = new Event("EscrowCreated",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // tradeId
                    new TypeReference<Address>(true) {},  // buyer
                    new TypeReference<Address>(true) {},  // seller
                    new TypeReference<Uint256>() {},      // amount
                    new TypeReference<Utf8String>() {}    // metadata
            ));

    public static final Event FUNDED_EVENT = new Event("Funded",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // tradeId
                    new TypeReference<Address>(true) {},  // payer
                    new TypeReference<Uint256>() {}       // amount
            ));

    public static final Event DELIVERY_CONFIRMED_EVENT = new Event("DeliveryConfirmed",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // tradeId
                    new TypeReference<Address>(true) {}   // confirmer
            ));

    public static final Event RELEASED_EVENT = new Event("Released",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // tradeId
                    new TypeReference<Address>(true) {},  // to
                    new TypeReference<Uint256>() {},      // amount
                    new TypeReference<Uint256>() {}       // fee
            ));

    public static final Event DISPUTED_EVENT = new Event("Disputed",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // tradeId
                    new TypeReference<Address>(true) {},  // by
                    new TypeReference<Utf8String>() {}    // reason
            ));

    public static final Event RESOLVED_EVENT = new Event("Resolved",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // tradeId
                    new TypeReference<Address>(true) {},  // to
                    new TypeReference<Uint256>() {},      // amount
                    new TypeReference<Utf8String>() {}    // resolution
            ));

    public static final Event TIMEOUT_REFUND_EVENT = new Event("TimeoutRefund",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // tradeId
                    new TypeReference<Address>(true) {},  // buyer
                    new TypeReference<Uint256>() {}       // amount
            ));

    public static final String ESCROW_CREATED_TOPIC = EventEncoder.encode(ESCROW_CREATED_EVENT);
    public static final String FUNDED_TOPIC = EventEncoder.encode(FUNDED_EVENT);
    public static final String DELIVERY_CONFIRMED_TOPIC = EventEncoder.encode(DELIVERY_CONFIRMED_EVENT);
    public static final String RELEASED_TOPIC = EventEncoder.encode(RELEASED_EVENT);
    public static final String DISPUTED_TOPIC = EventEncoder.encode(DISPUTED_EVENT);
    public static final String RESOLVED_TOPIC = EventEncoder.encode(RESOLVED_EVENT);
    public static final String TIMEOUT_REFUND_TOPIC = EventEncoder.encode(TIMEOUT_REFUND_EVENT);

    private HedgeEscrowAbi() {
    }

    /**
     * Encodes a state-changing call.
     */
    public static Function toFunction(LedgerCall call) {
        List<Type> inputs;
        switch (call.getFunction()) {
            case CREATE_AND_FUND:
            case CREATE_TRADE_WITHOUT_FUND:
                inputs = Arrays.asList(new Address(call.stringArgument(0)), new Utf8String(call.stringArgument(1)));
                break;
            case RAISE_DISPUTE:
                inputs = Arrays.asList(new Uint256(call.integerArgument(0)), new Utf8String(call.stringArgument(1)));
                break;
            case RESOLVE_DISPUTE:
                inputs = Arrays.asList(
                        new Uint256(call.integerArgument(0)),
                        new Address(call.stringArgument(1)),
                        new Uint256(call.integerArgument(2)),
                        new Utf8String(call.stringArgument(3)));
                break;
            case UPDATE_FEE_RECIPIENT:
                inputs = Collections.singletonList(new Address(call.stringArgument(0)));
                break;
            default:
                inputs = Collections.singletonList(new Uint256(call.integerArgument(0)));
                break;
        }
        return new Function(call.getFunction().getWireName(), inputs, Collections.emptyList());
    }

    public static Function getTrade(long tradeId) {
        return new Function(
                FUNC_GETTRADE,
                Collections.singletonList(new Uint256(tradeId)),
                Arrays.asList(
                        new TypeReference<Address>() {},
                        new TypeReference<Address>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Uint8>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Utf8String>() {}));
    }

    @SuppressWarnings("rawtypes")
    public static Trade toTrade(long tradeId, List<Type> values) {
        return Trade.builder()
                .tradeId(tradeId)
                .buyer(address(values.get(0)))
                .seller(address(values.get(1)))
                .amount(uint(values.get(2)))
                .state(TradeState.fromCode(uint(values.get(3)).intValueExact()))
                .createdAt(uint(values.get(4)).longValueExact())
                .timeoutAt(uint(values.get(5)).longValueExact())
                .metadata((String) values.get(6).getValue())
                .build();
    }

    /**
     * Decodes a log emitted by the escrow contract. Logs of other events are
     * ignored.
     */
    public static Optional<LedgerEvent> decode(Log log) {
        if (log.getTopics() == null || log.getTopics().isEmpty()) {
            return Optional.empty();
        }
        String topic = log.getTopics().get(0);

        if (ESCROW_CREATED_TOPIC.equals(topic)) {
            EventValues values = Contract.staticExtractEventParameters(ESCROW_CREATED_EVENT, log);
            return Optional.of(new LedgerEvent.EscrowCreated(
                    tradeId(values),
                    address(values.getIndexedValues().get(1)),
                    address(values.getIndexedValues().get(2)),
                    uint(values.getNonIndexedValues().get(0)),
                    (String) values.getNonIndexedValues().get(1).getValue()));
        }
        if (FUNDED_TOPIC.equals(topic)) {
            EventValues values = Contract.staticExtractEventParameters(FUNDED_EVENT, log);
            return Optional.of(new LedgerEvent.Funded(
                    tradeId(values),
                    address(values.getIndexedValues().get(1)),
                    uint(values.getNonIndexedValues().get(0))));
        }
        if (DELIVERY_CONFIRMED_TOPIC.equals(topic)) {
            EventValues values = Contract.staticExtractEventParameters(DELIVERY_CONFIRMED_EVENT, log);
            return Optional.of(new LedgerEvent.DeliveryConfirmed(
                    tradeId(values),
                    address(values.getIndexedValues().get(1))));
        }
        if (RELEASED_TOPIC.equals(topic)) {
            EventValues values = Contract.staticExtractEventParameters(RELEASED_EVENT, log);
            return Optional.of(new LedgerEvent.Released(
                    tradeId(values),
                    address(values.getIndexedValues().get(1)),
                    uint(values.getNonIndexedValues().get(0)),
                    uint(values.getNonIndexedValues().get(1))));
        }
        if (DISPUTED_TOPIC.equals(topic)) {
            EventValues values = Contract.staticExtractEventParameters(DISPUTED_EVENT, log);
            return Optional.of(new LedgerEvent.Disputed(
                    tradeId(values),
                    address(values.getIndexedValues().get(1)),
                    (String) values.getNonIndexedValues().get(0).getValue()));
        }
        if (RESOLVED_TOPIC.equals(topic)) {
            EventValues values = Contract.staticExtractEventParameters(RESOLVED_EVENT, log);
            return Optional.of(new LedgerEvent.Resolved(
                    tradeId(values),
                    address(values.getIndexedValues().get(1)),
                    uint(values.getNonIndexedValues().get(0)),
                    (String) values.getNonIndexedValues().get(1).getValue()));
        }
        if (TIMEOUT_REFUND_TOPIC.equals(topic)) {
            EventValues values = Contract.staticExtractEventParameters(TIMEOUT_REFUND_EVENT, log);
            return Optional.of(new LedgerEvent.TimeoutRefund(
                    tradeId(values),
                    address(values.getIndexedValues().get(1)),
                    uint(values.getNonIndexedValues().get(0))));
        }
        return Optional.empty();
    }

    private static long tradeId(EventValues values) {
        return uint(values.getIndexedValues().get(0)).longValueExact();
    }

    @SuppressWarnings("rawtypes")
    private static BigInteger uint(Type value) {
        return (BigInteger) value.getValue();
    }

    @SuppressWarnings("rawtypes")
    private static String address(Type value) {
        return ((Address) value).getValue().toLowerCase(Locale.ROOT);
    }
}
