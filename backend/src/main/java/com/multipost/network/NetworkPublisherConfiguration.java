package com.multipost.network;

import com.multipost.config.PublishingProperties;
import com.multipost.model.SocialNetwork;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Chooses which publishers back the registry. Simulated publishers cover every network;
 * live mode registers only the networks that have an API client.
 */
@Configuration
public class NetworkPublisherConfiguration {

    @Configuration
    @ConditionalOnProperty(
            prefix = "multipost.publishing",
            name = "mock-networks",
            havingValue = "true",
            matchIfMissing = true
    )
    static class SimulatedPublishers {

        @Bean
        NetworkPublisher simulatedFacebookPublisher() {
            return new SimulatedNetworkPublisher(SocialNetwork.FACEBOOK);
        }

        @Bean
        NetworkPublisher simulatedInstagramPublisher() {
            return new SimulatedNetworkPublisher(SocialNetwork.INSTAGRAM);
        }

        @Bean
        NetworkPublisher simulatedLinkedinPublisher() {
            return new SimulatedNetworkPublisher(SocialNetwork.LINKEDIN);
        }

        @Bean
        NetworkPublisher simulatedTiktokPublisher() {
            return new SimulatedNetworkPublisher(SocialNetwork.TIKTOK);
        }

        @Bean
        NetworkPublisher simulatedWhatsappPublisher() {
            return new SimulatedNetworkPublisher(SocialNetwork.WHATSAPP);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "multipost.publishing", name = "mock-networks", havingValue = "false")
    static class LivePublishers {

        @Bean
        NetworkPublisher facebookGraphPublisher(RestClient.Builder builder, PublishingProperties publishingProperties) {
            return new FacebookGraphNetworkPublisher(
                    builder.baseUrl(publishingProperties.getFacebook().getBaseUrl()).build(),
                    publishingProperties.getFacebook()
            );
        }

        @Bean
        NetworkPublisher instagramGraphPublisher(RestClient.Builder builder, PublishingProperties publishingProperties) {
            return new InstagramGraphNetworkPublisher(
                    builder.baseUrl(publishingProperties.getFacebook().getBaseUrl()).build(),
                    publishingProperties.getInstagram(),
                    publishingProperties.getFacebook()
            );
        }

        @Bean
        NetworkPublisher whapiWhatsappPublisher(RestClient.Builder builder, PublishingProperties publishingProperties) {
            return new WhapiWhatsappNetworkPublisher(
                    builder.baseUrl(publishingProperties.getWhatsapp().getBaseUrl()).build(),
                    publishingProperties.getWhatsapp()
            );
        }
    }
}
