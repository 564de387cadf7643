package com.xammer.probe.service.provider;

import com.xammer.probe.service.probe.ScrapeDeadline;

public interface CloudSessionFactory {

    /**
     * Reads provider credentials and authenticates. Called for every scrape and
     * every sweep, so a credential fix is picked up without a restart.
     *
     * @throws com.xammer.probe.exception.ConfigurationException when credentials
     *         or the endpoint are missing or rejected
     */
    CloudSession openSession(ScrapeDeadline deadline);
}
