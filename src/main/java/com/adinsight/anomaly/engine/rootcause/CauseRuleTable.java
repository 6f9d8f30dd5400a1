package com.adinsight.anomaly.engine.rootcause;

import com.adinsight.anomaly.engine.rootcause.CauseTemplate.Direction;
import com.adinsight.anomaly.model.ActionPriority;
import com.adinsight.anomaly.model.ActionTimeframe;
import com.adinsight.anomaly.model.AnomalySeverity;
import com.adinsight.anomaly.model.CauseCategory;
import com.adinsight.anomaly.model.CauseConfidence;
import com.adinsight.anomaly.model.MetricName;
import com.adinsight.anomaly.model.RootCauseAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.adinsight.anomaly.model.AnomalySeverity.CRITICAL;
import static com.adinsight.anomaly.model.AnomalySeverity.INFO;
import static com.adinsight.anomaly.model.AnomalySeverity.WARNING;

/**
 * Declarative table of candidate causes per metric. Adding a cause is a new row here.
 */
@Component
public class CauseRuleTable {

    private final Map<MetricName, List<CauseTemplate>> templates = new EnumMap<>(MetricName.class);

    public CauseRuleTable() {
        add(MetricName.SPEND, CauseTemplate.builder()
                .id("spend_budget_cap").category(CauseCategory.INTERNAL)
                .name("Budget cap reached")
                .description("The daily or lifetime budget was exhausted and delivery stopped.")
                .baseConfidence(CauseConfidence.HIGH)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Check budget pacing", "Check campaign delivery status"))
                .action(action("increase_budget", ActionPriority.HIGH, "Increase budget",
                        "Raise the daily budget to regain delivery.", "More impressions", ActionTimeframe.IMMEDIATE))
                .action(action("optimize_spend", ActionPriority.MEDIUM, "Reallocate spend",
                        "Move budget from inefficient ad sets to efficient ones.", "Better ROAS", ActionTimeframe.WITHIN_DAY))
                .build());
        add(MetricName.SPEND, CauseTemplate.builder()
                .id("spend_auction_competition").category(CauseCategory.EXTERNAL)
                .name("Auction competition")
                .description("Competitors raised their spend, intensifying the auction.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.INCREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Rising CPM", "More advertisers in the category"))
                .action(action("adjust_bidding", ActionPriority.HIGH, "Adjust bid strategy",
                        "Switch from lowest cost to a cost cap bid strategy.", "Stable costs", ActionTimeframe.WITHIN_WEEK))
                .action(action("expand_audience", ActionPriority.MEDIUM, "Expand audience",
                        "Target less contested audiences.", "Lower CPM", ActionTimeframe.WITHIN_WEEK))
                .build());
        add(MetricName.SPEND, CauseTemplate.builder()
                .id("spend_seasonal_surge").category(CauseCategory.MARKET)
                .name("Seasonal demand surge")
                .description("Seasonal demand pushed ad spend up.")
                .baseConfidence(CauseConfidence.HIGH)
                .direction(Direction.INCREASE).severity(INFO).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Seasonal event in progress", "Compare with the same period last year"))
                .action(action("ride_wave", ActionPriority.MEDIUM, "Ride the trend",
                        "Make the most of seasonal demand to maximise revenue.", "Higher revenue", ActionTimeframe.LONG_TERM))
                .action(action("prepare_creative", ActionPriority.HIGH, "Seasonal creatives",
                        "Prepare creatives that match the season.", "Better CTR", ActionTimeframe.IMMEDIATE))
                .build());

        add(MetricName.IMPRESSIONS, CauseTemplate.builder()
                .id("imp_audience_saturation").category(CauseCategory.INTERNAL)
                .name("Audience saturation")
                .description("Most of the target audience has already seen the ads.")
                .baseConfidence(CauseConfidence.HIGH)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .minMagnitudePct(25.0)
                .evidence(List.of("Rising frequency", "Flat reach"))
                .action(action("expand_targeting", ActionPriority.HIGH, "Expand targeting",
                        "Add lookalike audiences or broaden interests.", "Impressions recover", ActionTimeframe.WITHIN_WEEK))
                .action(action("refresh_creative", ActionPriority.MEDIUM, "Refresh creatives",
                        "Add new creatives to reduce ad fatigue.", "CTR holds", ActionTimeframe.WITHIN_DAY))
                .build());
        add(MetricName.IMPRESSIONS, CauseTemplate.builder()
                .id("imp_algorithm_learning").category(CauseCategory.TECHNICAL)
                .name("Delivery learning phase")
                .description("The delivery algorithm is still in its learning phase.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.DECREASE).severity(INFO).severity(WARNING)
                .maxMagnitudePct(40.0)
                .evidence(List.of("Campaign started within the last 7 days", "Ad set status: learning"))
                .action(action("wait_learning", ActionPriority.LOW, "Wait for learning to finish",
                        "Avoid changing settings until the learning phase completes.", "Optimisation completes", ActionTimeframe.WITHIN_WEEK))
                .action(action("check_conversions", ActionPriority.MEDIUM, "Check conversion volume",
                        "Make sure enough conversion events are being collected.", "Faster learning", ActionTimeframe.IMMEDIATE))
                .build());
        add(MetricName.IMPRESSIONS, CauseTemplate.builder()
                .id("imp_policy_violation").category(CauseCategory.TECHNICAL)
                .name("Policy restriction")
                .description("Delivery may be limited by an ad policy violation.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .minMagnitudePct(50.0)
                .evidence(List.of("Ad rejection notices", "Account quality warnings"))
                .action(action("check_policy", ActionPriority.CRITICAL, "Review policy status",
                        "Check the ads manager for policy violation notices.", "Delivery restored", ActionTimeframe.IMMEDIATE))
                .action(action("appeal_review", ActionPriority.HIGH, "Request a review",
                        "Request a re-review when the rejection is unjustified.", "Ads approved", ActionTimeframe.WITHIN_WEEK))
                .build());

        add(MetricName.CLICKS, CauseTemplate.builder()
                .id("click_creative_fatigue").category(CauseCategory.INTERNAL)
                .name("Creative fatigue")
                .description("Users respond less to creatives they have seen repeatedly.")
                .baseConfidence(CauseConfidence.HIGH)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Frequency above 3", "CTR declining steadily"))
                .action(action("new_creative", ActionPriority.HIGH, "Add new creatives",
                        "Add new images, video and copy.", "CTR recovers", ActionTimeframe.IMMEDIATE))
                .action(action("ab_test", ActionPriority.MEDIUM, "A/B test",
                        "Test several creative variants to find the best combination.", "Better performance", ActionTimeframe.WITHIN_WEEK))
                .build());
        add(MetricName.CLICKS, CauseTemplate.builder()
                .id("click_targeting_mismatch").category(CauseCategory.INTERNAL)
                .name("Targeting mismatch")
                .description("Ads are reaching people who are not interested.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Broad targeting", "Demographic mismatch"))
                .action(action("narrow_targeting", ActionPriority.HIGH, "Refine targeting",
                        "Use more specific interest and behaviour signals.", "Better CTR", ActionTimeframe.WITHIN_WEEK))
                .action(action("review_audience", ActionPriority.MEDIUM, "Audience insights",
                        "Analyse who actually responds to the ads.", "Better targeting", ActionTimeframe.IMMEDIATE))
                .build());

        add(MetricName.CONVERSIONS, CauseTemplate.builder()
                .id("conv_pixel_issue").category(CauseCategory.TECHNICAL)
                .name("Pixel tracking failure")
                .description("The tracking pixel is not recording conversions correctly.")
                .baseConfidence(CauseConfidence.HIGH)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Fewer pixel events", "Recent website changes"))
                .action(action("verify_pixel", ActionPriority.CRITICAL, "Verify the pixel",
                        "Use the pixel helper to confirm the pixel fires.", "Tracking restored", ActionTimeframe.IMMEDIATE))
                .action(action("check_events", ActionPriority.HIGH, "Check events",
                        "Confirm events are arriving in the events manager.", "Accurate data", ActionTimeframe.IMMEDIATE))
                .build());
        add(MetricName.CONVERSIONS, CauseTemplate.builder()
                .id("conv_landing_issue").category(CauseCategory.INTERNAL)
                .name("Landing page regression")
                .description("The landing page is slow or hard to use.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("High bounce rate", "Short time on page"))
                .action(action("speed_test", ActionPriority.HIGH, "Speed test",
                        "Measure page speed with PageSpeed Insights.", "Higher conversion rate", ActionTimeframe.IMMEDIATE))
                .action(action("mobile_test", ActionPriority.MEDIUM, "Mobile check",
                        "Make sure the landing page renders correctly on mobile.", "Better mobile conversions", ActionTimeframe.WITHIN_WEEK))
                .build());
        add(MetricName.CONVERSIONS, CauseTemplate.builder()
                .id("conv_checkout_friction").category(CauseCategory.INTERNAL)
                .name("Checkout friction")
                .description("Users abandon the checkout flow.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Lower purchase to add-to-cart ratio", "Drop-off at checkout steps"))
                .action(action("simplify_checkout", ActionPriority.HIGH, "Simplify checkout",
                        "Cut checkout steps and allow guest checkout.", "10-20% more conversions", ActionTimeframe.WITHIN_WEEK))
                .action(action("payment_options", ActionPriority.MEDIUM, "Add payment options",
                        "Offer more payment methods.", "Higher checkout completion", ActionTimeframe.LONG_TERM))
                .build());
        add(MetricName.CONVERSIONS, CauseTemplate.builder()
                .id("conv_market_downturn").category(CauseCategory.MARKET)
                .name("Market demand decline")
                .description("Overall market demand has fallen.")
                .baseConfidence(CauseConfidence.LOW)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Industry-wide trend", "Lower search volume"))
                .action(action("diversify", ActionPriority.MEDIUM, "Diversify products",
                        "Consider expanding into product lines with demand.", "Stable revenue", ActionTimeframe.LONG_TERM))
                .action(action("retention_focus", ActionPriority.HIGH, "Focus on existing customers",
                        "Prioritise retention over acquisition.", "Higher LTV", ActionTimeframe.IMMEDIATE))
                .build());

        add(MetricName.CTR, CauseTemplate.builder()
                .id("ctr_creative_relevance").category(CauseCategory.INTERNAL)
                .name("Creative relevance decay")
                .description("The creatives no longer match the audience's interests.")
                .baseConfidence(CauseConfidence.HIGH)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Falling relevance score", "Lower quality ranking"))
                .action(action("improve_copy", ActionPriority.HIGH, "Improve copy",
                        "Address the audience's pain points and needs directly.", "20-50% higher CTR", ActionTimeframe.IMMEDIATE))
                .action(action("visual_refresh", ActionPriority.MEDIUM, "Refresh visuals",
                        "Use eye-catching images and video.", "Better CTR", ActionTimeframe.IMMEDIATE))
                .build());
        add(MetricName.CTR, CauseTemplate.builder()
                .id("ctr_placement_issue").category(CauseCategory.INTERNAL)
                .name("Placement mix")
                .description("Delivery is concentrated on low-performing placements.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.DECREASE).severity(INFO).severity(WARNING)
                .evidence(List.of("Per-placement performance breakdown", "Automatic placements in use"))
                .action(action("placement_analysis", ActionPriority.MEDIUM, "Analyse placements",
                        "Break performance down by placement and exclude weak ones.", "Better CTR", ActionTimeframe.WITHIN_WEEK))
                .action(action("manual_placement", ActionPriority.LOW, "Manual placements",
                        "Select only the placements that perform.", "Focused CTR gains", ActionTimeframe.IMMEDIATE))
                .build());

        add(MetricName.CPA, CauseTemplate.builder()
                .id("cpa_competition_increase").category(CauseCategory.EXTERNAL)
                .name("Rising competition")
                .description("More advertisers are targeting the same audience.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.INCREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Rising CPM", "More ads in the category"))
                .action(action("unique_value", ActionPriority.HIGH, "Sharpen differentiation",
                        "Emphasise what sets the offer apart from competitors.", "Higher conversion rate", ActionTimeframe.LONG_TERM))
                .action(action("niche_targeting", ActionPriority.MEDIUM, "Niche targeting",
                        "Find narrower, less contested audiences.", "Lower CPA", ActionTimeframe.LONG_TERM))
                .build());
        add(MetricName.CPA, CauseTemplate.builder()
                .id("cpa_funnel_leak").category(CauseCategory.INTERNAL)
                .name("Funnel leak")
                .description("Users drop out at a specific step of the conversion funnel.")
                .baseConfidence(CauseConfidence.HIGH)
                .direction(Direction.INCREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Step-by-step conversion rates", "Drop-off points"))
                .action(action("funnel_analysis", ActionPriority.HIGH, "Analyse the funnel",
                        "Measure the drop-off rate of every funnel step.", "Problem step identified", ActionTimeframe.IMMEDIATE))
                .action(action("fix_friction", ActionPriority.CRITICAL, "Remove friction",
                        "Fix the UX of the steps with the highest drop-off.", "20-40% lower CPA", ActionTimeframe.LONG_TERM))
                .build());

        add(MetricName.ROAS, CauseTemplate.builder()
                .id("roas_attribution_delay").category(CauseCategory.TECHNICAL)
                .name("Attribution delay")
                .description("Conversions take time to be attributed to ads.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.DECREASE).severity(INFO).severity(WARNING)
                .evidence(List.of("Recent campaign changes", "7-day attribution window"))
                .action(action("wait_attribution", ActionPriority.LOW, "Wait for attribution",
                        "Wait until conversion data is fully reported.", "ROAS normalises", ActionTimeframe.WITHIN_WEEK))
                .action(action("check_window", ActionPriority.MEDIUM, "Check attribution window",
                        "Review the attribution window settings.", "Accurate data", ActionTimeframe.IMMEDIATE))
                .build());
        add(MetricName.ROAS, CauseTemplate.builder()
                .id("roas_price_change").category(CauseCategory.INTERNAL)
                .name("Price or product change")
                .description("Prices or the product mix changed.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Change in average order value", "Product mix change history"))
                .action(action("aov_analysis", ActionPriority.MEDIUM, "Analyse AOV",
                        "Analyse how the average order value changed.", "Cause identified", ActionTimeframe.IMMEDIATE))
                .action(action("bundle_offer", ActionPriority.MEDIUM, "Bundle offers",
                        "Raise AOV with bundles and upsells.", "Better ROAS", ActionTimeframe.LONG_TERM))
                .build());

        add(MetricName.CPC, CauseTemplate.builder()
                .id("cpc_bid_competition").category(CauseCategory.EXTERNAL)
                .name("Bid competition")
                .description("Bidding for the same audience has intensified.")
                .baseConfidence(CauseConfidence.HIGH)
                .direction(Direction.INCREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("CPM rising alongside", "Higher suggested bids"))
                .action(action("bid_strategy", ActionPriority.HIGH, "Change bid strategy",
                        "Try switching between manual and automatic bidding.", "Optimised CPC", ActionTimeframe.WITHIN_WEEK))
                .action(action("quality_focus", ActionPriority.MEDIUM, "Improve quality",
                        "Raise ad quality to win auctions more cheaply.", "Lower CPC", ActionTimeframe.LONG_TERM))
                .build());

        add(MetricName.CVR, CauseTemplate.builder()
                .id("cvr_user_experience").category(CauseCategory.INTERNAL)
                .name("User experience problem")
                .description("The website has usability problems.")
                .baseConfidence(CauseConfidence.HIGH)
                .direction(Direction.DECREASE).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("Shorter sessions", "Higher bounce rate"))
                .action(action("ux_audit", ActionPriority.HIGH, "UX audit",
                        "Audit the usability of the main conversion paths.", "Higher conversion rate", ActionTimeframe.LONG_TERM))
                .action(action("speed_optimization", ActionPriority.CRITICAL, "Optimise speed",
                        "Bring page load time under three seconds.", "About 7% CVR per second saved", ActionTimeframe.WITHIN_WEEK))
                .build());
        add(MetricName.CVR, CauseTemplate.builder()
                .id("cvr_offer_mismatch").category(CauseCategory.INTERNAL)
                .name("Offer mismatch")
                .description("The ad and the landing page tell different stories.")
                .baseConfidence(CauseConfidence.MEDIUM)
                .direction(Direction.DECREASE).severity(INFO).severity(WARNING).severity(CRITICAL)
                .evidence(List.of("High bounce rate", "Low engagement"))
                .action(action("message_match", ActionPriority.HIGH, "Match the message",
                        "Align the ad copy with the landing page message.", "Better CVR", ActionTimeframe.IMMEDIATE))
                .action(action("dedicated_landing", ActionPriority.MEDIUM, "Dedicated landing page",
                        "Build a landing page dedicated to each campaign.", "20-50% higher CVR", ActionTimeframe.LONG_TERM))
                .build());
    }

    public List<CauseTemplate> templatesFor(MetricName metric) {
        return templates.getOrDefault(metric, List.of());
    }

    private void add(MetricName metric, CauseTemplate template) {
        templates.computeIfAbsent(metric, m -> new ArrayList<>()).add(template);
    }

    static RootCauseAction action(String id, ActionPriority priority, String title, String description,
                                  String estimatedImpact, ActionTimeframe timeframe) {
        return RootCauseAction.builder()
                .id(id)
                .priority(priority)
                .title(title)
                .description(description)
                .estimatedImpact(estimatedImpact)
                .timeframe(timeframe)
                .build();
    }
}
