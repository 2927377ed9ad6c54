package com.finopsguard.recommendation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SkuFamiliesTest {

    @ParameterizedTest
    @CsvSource({
            "t3.medium, t3.*",
            "m5.2xlarge, m5.*",
            "db.t3.micro, db.t3.*",
            "t3.small.search, t3.*.search",
            "Standard_D4s_v3, Standard_D*s_v3",
            "e2-standard-8, e2-standard-*",
            "e2-medium, e2-*"
    })
    @DisplayName("Should group SKUs that differ only in size")
    void shouldGroupBySize(String sku, String family) {
        assertThat(SkuFamilies.familyOf(sku)).contains(family);
    }

    @Test
    @DisplayName("Should not group service SKUs")
    void shouldNotGroupServiceSkus() {
        assertThat(SkuFamilies.familyOf("aws_eks_cluster")).isEmpty();
        assertThat(SkuFamilies.familyOf("db-f1-micro")).isEmpty();
        assertThat(SkuFamilies.familyOf(null)).isEmpty();
    }
}
