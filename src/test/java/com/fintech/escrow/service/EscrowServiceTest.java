package com.fintech.escrow.service;

import com.fintech.escrow.dto.AgreementReference;
import com.fintech.escrow.dto.EscrowView;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.exception.EscrowNotFoundException;
import com.fintech.escrow.exception.EscrowValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for EscrowService.
 * <p>
 * Tests cover:
 * - Agreement validation on creation
 * - Address normalization
 * - Reads by id and agreement
 */
@ExtendWith(MockitoExtension.class)
class EscrowServiceTest {

    private static final String BUYER = "0x1111111111111111111111111111111111111111";
    private static final String SELLER = "0xABCDEFabcdef2222222222222222222222222222";
    private static final BigInteger ONE_ETHER = new BigInteger("1000000000000000000");

    @Mock
    private EscrowRecordStore store;

    @InjectMocks
    private EscrowService escrowService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(escrowService, "maxAmountWei", new BigInteger("100").multiply(ONE_ETHER));
        ReflectionTestUtils.setField(escrowService, "maxVerificationAttempts", 5);
        lenient().when(store.now()).thenReturn(LocalDateTime.of(2026, 3, 1, 12, 0));
    }

    @Nested
    @DisplayName("Creation Tests")
    class CreationTests {

        @Test
        @DisplayName("Should create an escrow awaiting funds with lower-case addresses")
        void shouldCreateEscrow() {
            // Given
            when(store.create(any(EscrowRecord.class))).thenAnswer(invocation -> {
                EscrowRecord record = invocation.getArgument(0);
                record.setId(1L);
                record.setState(EscrowState.AWAITING_FUND);
                return record;
            });

            // When
            EscrowView view = escrowService.create(agreement(ONE_ETHER));

            // Then
            ArgumentCaptor<EscrowRecord> captor = ArgumentCaptor.forClass(EscrowRecord.class);
            verify(store).create(captor.capture());
            assertThat(captor.getValue().getSellerAddress()).isEqualTo(SELLER.toLowerCase());
            assertThat(captor.getValue().getAmountWei()).isEqualTo(ONE_ETHER);

            assertThat(view.getId()).isEqualTo(1L);
            assertThat(view.getState()).isEqualTo(EscrowState.AWAITING_FUND);
            assertThat(view.getPermissions().isCanBeFunded()).isTrue();
        }

        @Test
        @DisplayName("Should reject an agreement where buyer and seller are the same user")
        void shouldRejectSameUser() {
            AgreementReference agreement = agreement(ONE_ETHER);
            agreement.setSellerId(agreement.getBuyerId());

            assertThatThrownBy(() -> escrowService.create(agreement))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("different users");
            verify(store, never()).create(any());
        }

        @Test
        @DisplayName("Should reject a malformed seller address")
        void shouldRejectMalformedAddress() {
            AgreementReference agreement = agreement(ONE_ETHER);
            agreement.setSellerAddress("0x1234");

            assertThatThrownBy(() -> escrowService.create(agreement))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("seller");
        }

        @Test
        @DisplayName("Should reject the zero address")
        void shouldRejectZeroAddress() {
            AgreementReference agreement = agreement(ONE_ETHER);
            agreement.setBuyerAddress("0x0000000000000000000000000000000000000000");

            assertThatThrownBy(() -> escrowService.create(agreement))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("buyer");
        }

        @Test
        @DisplayName("Should reject buyer and seller sharing an address regardless of case")
        void shouldRejectSharedAddress() {
            AgreementReference agreement = agreement(ONE_ETHER);
            agreement.setBuyerAddress(SELLER.toLowerCase());

            assertThatThrownBy(() -> escrowService.create(agreement))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("share");
        }

        @Test
        @DisplayName("Should reject zero and oversized amounts")
        void shouldRejectAmountsOutOfRange() {
            assertThatThrownBy(() -> escrowService.create(agreement(BigInteger.ZERO)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("positive");

            assertThatThrownBy(() -> escrowService.create(agreement(new BigInteger("101").multiply(ONE_ETHER))))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("exceeds");
        }
    }

    @Nested
    @DisplayName("Read Tests")
    class ReadTests {

        @Test
        @DisplayName("Should compute permissions for the requesting actor")
        void shouldComputePermissionsPerActor() {
            EscrowRecord record = record(EscrowState.FUNDED);
            when(store.getRequired(1L)).thenReturn(record);

            EscrowView sellerView = escrowService.getView(1L, 20L);

            assertThat(sellerView.getPermissions().isCanConfirmDelivery()).isTrue();
            assertThat(sellerView.getPermissions().isCanBeFunded()).isFalse();
        }

        @Test
        @DisplayName("Should report a missing agreement as not found")
        void shouldReportMissingAgreement() {
            when(store.findByAgreementId("AGR-404")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> escrowService.getViewByAgreement("AGR-404", null))
                .isInstanceOf(EscrowNotFoundException.class)
                .hasMessageContaining("AGR-404");
        }
    }

    private static AgreementReference agreement(BigInteger amount) {
        return AgreementReference.builder()
            .agreementId("AGR-1")
            .buyerId(10L)
            .sellerId(20L)
            .buyerAddress(BUYER)
            .sellerAddress(SELLER)
            .agreedAmountWei(amount)
            .build();
    }

    private static EscrowRecord record(EscrowState state) {
        return EscrowRecord.builder()
            .id(1L)
            .agreementId("AGR-1")
            .buyerId(10L)
            .sellerId(20L)
            .buyerAddress(BUYER)
            .sellerAddress(SELLER.toLowerCase())
            .amountWei(ONE_ETHER)
            .state(state)
            .build();
    }
}
