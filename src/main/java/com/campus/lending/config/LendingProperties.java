package com.campus.lending.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Externalised lending settings, bound from the {@code lending.*} namespace.
 *
 * <p>{@code loan.overdueFeePerDay} is the only place the late-return rate is defined.
 * Fee computation and any tooling that needs a rate must read it from here.
 *
 * <p>{@code bootstrapAdmin} names the system administrator created on startup when the
 * database has none. Leave {@code email} empty to skip it.
 */
@Validated
@ConfigurationProperties(prefix = "lending")
public record LendingProperties(

    @DefaultValue("UTC")
    ZoneId timeZone,

    @Valid
    @DefaultValue
    Loan loan,

    @DefaultValue
    BootstrapAdmin bootstrapAdmin
) {

    public record Loan(

        @NotNull
        @DecimalMin("0.00")
        @DefaultValue("10.00")
        BigDecimal overdueFeePerDay,

        @NotNull
        @DefaultValue("P3D")
        Duration defaultPeriod
    ) {}

    public record BootstrapAdmin(
        String email,
        String password,
        @DefaultValue("System Administrator") String fullName
    ) {
        public boolean isConfigured() {
            return email != null && !email.isBlank();
        }
    }
}
