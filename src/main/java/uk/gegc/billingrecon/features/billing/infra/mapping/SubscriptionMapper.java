package uk.gegc.billingrecon.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.mapstruct.ReportingPolicy;
import uk.gegc.billingrecon.features.billing.api.dto.SubscriptionDto;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.Subscription;
import uk.gegc.billingrecon.features.billing.domain.model.SubscriptionStatus;

import java.util.Locale;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SubscriptionMapper {

    @Mapping(target = "plan", source = "plan", qualifiedByName = "planCode")
    @Mapping(target = "status", source = "status", qualifiedByName = "statusCode")
    @Mapping(target = "provider", source = "provider", qualifiedByName = "providerCode")
    @Mapping(target = "subscriptionCode", source = "providerSubscriptionCode")
    SubscriptionDto toDto(Subscription subscription);

    @Named("planCode")
    default String planCode(PlanTier plan) {
        return plan != null ? plan.getCode() : null;
    }

    @Named("statusCode")
    default String statusCode(SubscriptionStatus status) {
        return status != null ? status.name().toLowerCase(Locale.ROOT) : null;
    }

    @Named("providerCode")
    default String providerCode(PaymentProvider provider) {
        return provider != null ? provider.getCode() : null;
    }
}
