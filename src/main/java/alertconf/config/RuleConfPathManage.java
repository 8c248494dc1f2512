package alertconf.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class RuleConfPathManage {

    @Value("${ruleconf.config.path}")
    public String ruleConfConfigPath;
}
