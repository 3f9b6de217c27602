package world.willfrog.agentrun;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
@MapperScan({"world.willfrog.agentrun.mapper", "world.willfrog.agentrun.common.dao"})
public class AgentRunApplication {
    public static void main(String[] args) {
        SpringApplication.run(AgentRunApplication.class, args);
    }
}
