/**
 * Spring Boot auto-configuration for the campaign engine.
 *
 * @see campaign.spring.boot.CampaignAutoConfiguration
 * @see campaign.spring.boot.CampaignProperties
 */
package campaign.spring.boot;
