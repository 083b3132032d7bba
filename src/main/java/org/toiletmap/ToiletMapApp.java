package org.toiletmap;

import org.springframework.beans.BeansException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.admin.SpringApplicationAdminJmxAutoConfiguration;
import org.springframework.boot.autoconfigure.cache.CacheAutoConfiguration;
import org.springframework.boot.autoconfigure.data.jdbc.JdbcRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.data.web.SpringDataWebAutoConfiguration;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.gson.GsonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.jmx.JmxAutoConfiguration;
import org.springframework.boot.autoconfigure.liquibase.LiquibaseAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.autoconfigure.ssl.SslAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.ReactiveMultipartAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.WebSessionIdResolverAutoConfiguration;
import org.springframework.boot.autoconfigure.web.servlet.DispatcherServletAutoConfiguration;
import org.springframework.boot.autoconfigure.web.servlet.WebMvcAutoConfiguration;
import org.springframework.boot.web.context.WebServerGracefulShutdownLifecycle;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.ComponentScan;
import org.toiletmap.global.rest.JwtAuthenticationManager;
import org.toiletmap.init.InitDB;

import lombok.extern.slf4j.Slf4j;

@SpringBootApplication(exclude= {
	JmxAutoConfiguration.class,
	ReactiveMultipartAutoConfiguration.class,
	SpringApplicationAdminJmxAutoConfiguration.class,
	SqlInitializationAutoConfiguration.class,
	SslAutoConfiguration.class,
	WebSessionIdResolverAutoConfiguration.class,
	CacheAutoConfiguration.class,
	DispatcherServletAutoConfiguration.class,
	FlywayAutoConfiguration.class,
	GsonAutoConfiguration.class,
	HibernateJpaAutoConfiguration.class,
	JdbcRepositoriesAutoConfiguration.class,
	JdbcTemplateAutoConfiguration.class,
	JpaRepositoriesAutoConfiguration.class,
	LiquibaseAutoConfiguration.class,
	SpringDataWebAutoConfiguration.class,
	WebMvcAutoConfiguration.class
})
@ComponentScan
@Slf4j
public class ToiletMapApp implements SmartLifecycle, ApplicationContextAware {

	public static void main(String[] args) {
		SpringApplication.run(ToiletMapApp.class, args);
	}

	public void initApp() {
		InitDB init = new InitDB();
		context.getAutowireCapableBeanFactory().autowireBean(init);
		init.init();
		checks(context);
	}

	private void checks(ApplicationContext ctx) {
		var jwt = ctx.getBean(JwtAuthenticationManager.class);
		if (jwt.isIssuerChecked()) {
			log.info(" ✔ JWT issuer and audience checks activated");
		} else {
			log.warn(" ❌ JWT issuer or audience not configured, any token signed with the shared secret will be accepted !");
		}
	}

	private boolean running = false;
	private ApplicationContext context;

	@Override
	public void start() {
		initApp();
		running = true;
	}

	@Override
	public void stop() {
		running = false;
	}

	@Override
	public boolean isRunning() {
		return running;
	}

	@Override
	public int getPhase() {
		// WebServerStartStopLifecycle - 1 to do it before the web server is exposed
		return WebServerGracefulShutdownLifecycle.SMART_LIFECYCLE_PHASE - 1025;
	}

	@Override
	public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
		context = applicationContext;
	}
}
