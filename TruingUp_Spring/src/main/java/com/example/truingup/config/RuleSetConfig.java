// ============================================================
// RuleSetConfig.java
// ------------------------------------------------------------
// Role
// 1) Registers every known-good constants version (RuleSets.all()) once at start-up.
// 2) Activates the version named by truingup.rules.active-version.
//
// Usage
// - application.properties:
//     truingup.rules.active-version=KSERC-MYT-2022-27-v1.0
// - Services inject RuleSetRegistry, resolve an instance once per request and pass it
//   into a RuleEngine. Nothing reads "the current version" mid-computation.
//
// Notes
// - Constant values are not bindable from properties. Only the choice of version is.
// ============================================================
package com.example.truingup.config;

import com.example.truingup.engine.RuleSetRegistry;
import com.example.truingup.engine.RuleSets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuleSetConfig {

	@Value("${truingup.rules.active-version:" + RuleSets.KSERC_MYT_2022_27_V1 + "}")
	private String activeVersion;

	@Bean
	public RuleSetRegistry ruleSetRegistry() {
		return new RuleSetRegistry(RuleSets.all(), activeVersion);
	}
}
