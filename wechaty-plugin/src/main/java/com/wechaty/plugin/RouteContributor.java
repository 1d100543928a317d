package com.wechaty.plugin;

import com.wechaty.plugin.http.RouteRegistrar;

/**
 * Optional plugin capability: contribute HTTP routes to the embedded web
 * server. Called once per plugin while the manager starts.
 */
public interface RouteContributor {

    void contributeRoutes(RouteRegistrar routes) throws Exception;
}
