package com.flagship.pos_inventory.purchase;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PurchaseLineItemId implements Serializable {

    @Column(name = "purchase_no", nullable = false, updatable = false)
    private String purchaseNo;

    @Column(name = "product_code", nullable = false, updatable = false)
    private String productCode;
}
