/**
 * JUnit Jupiter integration: {@link com.questrail.disttest.junit.DistributedTest}.
 */
package com.questrail.disttest.junit;
