/**
 * Clock offset estimation against the controller, fed by client/time and server/time round trips.
 */
package com.phillippitts.sendspin.service.clock;
