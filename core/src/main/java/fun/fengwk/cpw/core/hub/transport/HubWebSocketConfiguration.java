package fun.fengwk.cpw.core.hub.transport;

import fun.fengwk.cpw.core.hub.AgentHub;
import fun.fengwk.cpw.core.hub.HubProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * @author fengwk
 */
@Configuration
@EnableWebSocket
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@RequiredArgsConstructor
public class HubWebSocketConfiguration implements WebSocketConfigurer {

    private final AgentHub agentHub;
    private final HubProperties hubProperties;

    @Bean
    public HubWebSocketHandler hubWebSocketHandler() {
        return new HubWebSocketHandler(agentHub);
    }

    @Bean
    public ServletServerContainerFactoryBean hubWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(hubProperties.getMaxMessageBytes());
        container.setMaxBinaryMessageBufferSize(hubProperties.getMaxMessageBytes());
        return container;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(hubWebSocketHandler(), hubProperties.getPath())
            .addInterceptors(new AgentHandshakeInterceptor())
            .setAllowedOriginPatterns("*");
    }

}
