/*
 * どこで: Perks アプリの設定バインド
 * 何を: 特典種別の一覧とティアごとの付与量/繰越上限を保持する
 * なぜ: ティアのルールをコードから外し、起動時に一度だけ検証して固定するため
 */
package com.example.perks.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "perks")
public record PerksTierProperties(
        @NotEmpty List<@NotBlank String> perkTypes,
        @NotEmpty Map<String, @Valid @NotNull TierProperties> tiers) {

    public static final String UNBOUNDED = "unbounded";

    public record TierProperties(@NotEmpty Map<String, @Valid @NotNull PerkProperties> perks) {
    }

    public record PerkProperties(
            @NotNull @PositiveOrZero Integer allotment,
            @NotBlank @Pattern(regexp = "unbounded|\\d+", message = "rollover-cap must be a non-negative integer or 'unbounded'")
            String rolloverCap) {
    }
}
