package com.kreasipositif.baiprocessor.bai2.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A {@code 16} transaction detail record.
 *
 * <p>{@code amount} is kept exactly as reported: an integer string in minor currency units.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRecord {

    @Builder.Default
    private String typeCode = "";

    @Builder.Default
    private String amount = "";

    @Builder.Default
    private String fundsType = "";

    @Builder.Default
    private String bankReference = "";

    @Builder.Default
    private String customerReference = "";

    /** Free text, including any commas it carried and any {@code 88} continuations. */
    @Builder.Default
    private String text = "";

    /** Ancestor snapshot; {@link TransactionContext#EMPTY} when no account and group were open. */
    @Builder.Default
    private TransactionContext context = TransactionContext.EMPTY;
}
