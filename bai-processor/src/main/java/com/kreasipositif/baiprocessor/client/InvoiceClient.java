package com.kreasipositif.baiprocessor.client;

import com.kreasipositif.baiprocessor.domain.Invoice;
import com.kreasipositif.baiprocessor.exception.InvoiceServiceException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * REST client for the invoice service that owns open receivables.
 *
 * <p>Pages through {@code GET /api/v1/invoices/open?limit=&offset=} until the service reports
 * {@code hasMore=false}. Every page request runs inside the {@code invoiceServiceBulkhead} and is
 * retried by {@code invoiceServiceRetry}.
 */
@Slf4j
@Component
public class InvoiceClient {

    static final String DEFAULT_CURRENCY = "USD";

    private final RestClient restClient;
    private final Bulkhead bulkhead;
    private final Retry retry;
    private final int pageSize;
    private final String invoiceUrlTemplate;

    public InvoiceClient(
            RestClient.Builder builder,
            @Qualifier("invoiceServiceBulkhead") Bulkhead bulkhead,
            @Qualifier("invoiceServiceRetry") Retry retry,
            @Value("${downstream.invoice-service.base-url}") String baseUrl,
            @Value("${downstream.invoice-service.page-size:1000}") int pageSize,
            @Value("${downstream.invoice-service.invoice-url-template}") String invoiceUrlTemplate) {
        this.restClient = builder.baseUrl(baseUrl).build();
        this.bulkhead = bulkhead;
        this.retry = retry;
        this.pageSize = pageSize;
        this.invoiceUrlTemplate = invoiceUrlTemplate;
    }

    /**
     * Fetches every open invoice, in the order the service returns them.
     *
     * @throws InvoiceServiceException when a page cannot be fetched after retries
     */
    public List<Invoice> fetchOpenInvoices() {
        List<Invoice> invoices = new ArrayList<>();
        int offset = 0;
        boolean hasMore = true;

        while (hasMore) {
            InvoicePage page = fetchPage(offset);
            List<InvoiceResponse> items = page.items() != null ? page.items() : List.of();
            items.stream().map(this::toInvoice).forEach(invoices::add);
            offset += items.size();
            // an empty page ends paging even if the service still claims more
            hasMore = page.hasMore() && !items.isEmpty();
        }

        log.info("Fetched {} open invoice(s) from invoice-service", invoices.size());
        return invoices;
    }

    private InvoicePage fetchPage(int offset) {
        Supplier<InvoicePage> call = Bulkhead.decorateSupplier(bulkhead, () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/invoices/open")
                        .queryParam("limit", pageSize)
                        .queryParam("offset", offset)
                        .build())
                .retrieve()
                .body(InvoicePage.class));
        try {
            InvoicePage page = Retry.decorateSupplier(retry, call).get();
            if (page == null) {
                log.warn("Invoice page at offset={} returned null response", offset);
                return new InvoicePage(List.of(), false);
            }
            return page;
        } catch (RestClientException e) {
            throw new InvoiceServiceException(
                    "Failed to fetch open invoices at offset=" + offset + ": " + e.getMessage(), e);
        } catch (BulkheadFullException e) {
            log.warn("invoice-service bulkhead full at offset={}", offset);
            throw new InvoiceServiceException(
                    "invoice-service bulkhead full at offset=" + offset + ": " + e.getMessage(), e);
        }
    }

    Invoice toInvoice(InvoiceResponse response) {
        String id = response.id() != null ? response.id() : "";
        return new Invoice(
                id,
                response.tranId() != null ? response.tranId() : "",
                displayName(response),
                response.amountRemaining() != null ? response.amountRemaining() : BigDecimal.ZERO,
                hasText(response.currency()) ? response.currency() : DEFAULT_CURRENCY,
                response.dueDate() != null ? response.dueDate() : "",
                invoiceUrlTemplate.replace("{id}", id));
    }

    /**
     * Company name, else "first last", else the customer's entity id.
     */
    static String displayName(InvoiceResponse response) {
        if (hasText(response.companyName())) {
            return response.companyName().trim();
        }
        String person = ((response.firstName() != null ? response.firstName() : "") + " "
                + (response.lastName() != null ? response.lastName() : "")).trim();
        if (!person.isEmpty()) {
            return person;
        }
        return response.entityId() != null ? response.entityId().trim() : "";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    // ─── Response records (inline) ──────────────

    public record InvoicePage(List<InvoiceResponse> items, boolean hasMore) {}

    public record InvoiceResponse(
            String id,
            String tranId,
            String companyName,
            String firstName,
            String lastName,
            String entityId,
            BigDecimal amountRemaining,
            String currency,
            String dueDate) {}
}
